package io.surfworks.parloops.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

import io.surfworks.parloops.ir.Attributes.Attribute;
import io.surfworks.parloops.ir.IrTypes.Type;

/**
 * A generic IR operation.
 *
 * <p>An operation has a dotted name ({@code dialect.op}), operands, results,
 * an ordered attribute dictionary and zero or more nested regions. Dialect
 * classes wrap operations in typed views; the generic form is what the
 * rewrite engine, the cloner, the printer and the interpreter work on.
 *
 * <p>Example:
 * <pre>{@code
 * Operation load = Operation.create("std.load", loc,
 *         List.of(buffer, i, j), List.of(ScalarType.F32), Map.of(), 0);
 * }</pre>
 */
public final class Operation {

    private final String name;
    private final Location location;
    private final List<Value> operands;
    private final List<Value> results;
    private final Map<String, Attribute> attributes;
    private final List<Region> regions;
    private Block parentBlock;

    private Operation(
            String name,
            Location location,
            List<Value> operands,
            List<Type> resultTypes,
            Map<String, Attribute> attributes,
            int numRegions) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.location = location != null ? location : Location.UNKNOWN;
        this.operands = new ArrayList<>(operands);
        for (Value operand : this.operands) {
            Objects.requireNonNull(operand, () -> "null operand for " + name);
        }
        List<Value> res = new ArrayList<>(resultTypes.size());
        for (int i = 0; i < resultTypes.size(); i++) {
            res.add(Value.result(this, i, resultTypes.get(i)));
        }
        this.results = Collections.unmodifiableList(res);
        this.attributes = new LinkedHashMap<>(attributes);
        List<Region> regs = new ArrayList<>(numRegions);
        for (int i = 0; i < numRegions; i++) {
            regs.add(new Region(this));
        }
        this.regions = Collections.unmodifiableList(regs);
    }

    /**
     * Creates a detached operation. Use {@link OpBuilder} to create and insert in one step.
     */
    public static Operation create(
            String name,
            Location location,
            List<Value> operands,
            List<Type> resultTypes,
            Map<String, Attribute> attributes,
            int numRegions) {
        return new Operation(name, location, operands, resultTypes, attributes, numRegions);
    }

    public String name() {
        return name;
    }

    /**
     * Returns the dialect prefix, e.g. {@code "lhlo"} for {@code lhlo.reduce}.
     */
    public String dialect() {
        int dot = name.indexOf('.');
        return dot < 0 ? "" : name.substring(0, dot);
    }

    public boolean isA(String opName) {
        return name.equals(opName);
    }

    public Location location() {
        return location;
    }

    public List<Value> operands() {
        return Collections.unmodifiableList(operands);
    }

    public Value operand(int i) {
        return operands.get(i);
    }

    public int numOperands() {
        return operands.size();
    }

    public void setOperand(int i, Value value) {
        operands.set(i, Objects.requireNonNull(value, "value cannot be null"));
    }

    public List<Value> results() {
        return results;
    }

    public Value result(int i) {
        return results.get(i);
    }

    /**
     * Returns the single result of this operation.
     */
    public Value result() {
        if (results.size() != 1) {
            throw new IllegalStateException(name + " has " + results.size() + " results, expected 1");
        }
        return results.get(0);
    }

    public int numResults() {
        return results.size();
    }

    public List<Type> resultTypes() {
        return results.stream().map(Value::type).toList();
    }

    public Map<String, Attribute> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public Attribute attribute(String attrName) {
        return attributes.get(attrName);
    }

    /**
     * Returns the attribute cast to the expected kind, or null if absent.
     *
     * @throws IllegalStateException if present with a different kind
     */
    public <T extends Attribute> T attribute(String attrName, Class<T> kind) {
        Attribute attr = attributes.get(attrName);
        if (attr == null) {
            return null;
        }
        if (!kind.isInstance(attr)) {
            throw new IllegalStateException(String.format("Attribute '%s' of %s is %s, expected %s",
                    attrName, name, attr.getClass().getSimpleName(), kind.getSimpleName()));
        }
        return kind.cast(attr);
    }

    public boolean hasAttribute(String attrName) {
        return attributes.containsKey(attrName);
    }

    public void setAttribute(String attrName, Attribute value) {
        attributes.put(attrName, Objects.requireNonNull(value, "value cannot be null"));
    }

    public List<Region> regions() {
        return regions;
    }

    public Region region(int i) {
        return regions.get(i);
    }

    public int numRegions() {
        return regions.size();
    }

    /**
     * Terminators end a block: {@code *.terminator}, {@code *.yield} and {@code *.return}.
     */
    public boolean isTerminator() {
        return name.endsWith(".terminator") || name.endsWith(".yield") || name.endsWith(".return");
    }

    public Block parentBlock() {
        return parentBlock;
    }

    void setParentBlock(Block block) {
        this.parentBlock = block;
    }

    /**
     * Returns the operation owning the region this operation lives in, or null
     * at function level or when detached.
     */
    public Operation parentOp() {
        if (parentBlock == null || parentBlock.parentRegion() == null) {
            return null;
        }
        return parentBlock.parentRegion().parentOp();
    }

    /**
     * Returns true if {@code other} is nested (at any depth) inside this operation.
     */
    public boolean isProperAncestor(Operation other) {
        Operation current = other.parentOp();
        while (current != null) {
            if (current == this) {
                return true;
            }
            current = current.parentOp();
        }
        return false;
    }

    /**
     * Unlinks this operation from its block. Nested regions go with it.
     */
    public void erase() {
        if (parentBlock == null) {
            throw new IllegalStateException("Operation " + name + " is not attached to a block");
        }
        parentBlock.remove(this);
    }

    /**
     * Visits this operation and every nested operation in pre-order.
     */
    public void walk(Consumer<Operation> visitor) {
        visitor.accept(this);
        for (Region region : regions) {
            for (Block block : region.blocks()) {
                for (Operation nested : List.copyOf(block.operations())) {
                    nested.walk(visitor);
                }
            }
        }
    }

    /**
     * Deep-copies this operation.
     *
     * <p>Operands are substituted through {@code mapping}; values it does not
     * contain are used as-is. Results of the copy, and arguments of every
     * copied block, are added to the mapping so later clones see them.
     *
     * @param mapping value substitution table, updated in place
     * @return a detached copy
     */
    public Operation clone(IrMapping mapping) {
        List<Value> newOperands = new ArrayList<>(operands.size());
        for (Value operand : operands) {
            newOperands.add(mapping.lookupOrDefault(operand));
        }
        Operation copy = new Operation(name, location, newOperands, resultTypes(), attributes, regions.size());
        mapping.map(results, copy.results);
        for (int i = 0; i < regions.size(); i++) {
            regions.get(i).cloneInto(copy.regions.get(i), mapping);
        }
        return copy;
    }

    @Override
    public String toString() {
        return String.format("Operation[%s, operands=%d, results=%d, regions=%d]",
                name, operands.size(), results.size(), regions.size());
    }
}

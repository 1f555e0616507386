package io.surfworks.parloops.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered list of blocks owned by an operation or a function.
 */
public final class Region {

    private final List<Block> blocks = new ArrayList<>();
    private final Operation parentOp;

    Region(Operation parentOp) {
        this.parentOp = parentOp;
    }

    /**
     * Creates a region that is not owned by any operation (a function body).
     */
    public static Region detached() {
        return new Region(null);
    }

    public Operation parentOp() {
        return parentOp;
    }

    public List<Block> blocks() {
        return Collections.unmodifiableList(blocks);
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }

    /**
     * Appends a new empty block.
     */
    public Block addBlock() {
        Block block = new Block();
        addBlock(block);
        return block;
    }

    public void addBlock(Block block) {
        if (block.parentRegion() != null) {
            throw new IllegalStateException("Block already belongs to a region");
        }
        block.setParentRegion(this);
        blocks.add(block);
    }

    /**
     * Returns the entry block.
     */
    public Block front() {
        if (blocks.isEmpty()) {
            throw new IllegalStateException("Region has no blocks");
        }
        return blocks.get(0);
    }

    /**
     * Clones every block of this region into {@code dest}, recording block
     * arguments and op results in {@code mapping}.
     */
    public void cloneInto(Region dest, IrMapping mapping) {
        List<Block> copies = new ArrayList<>(blocks.size());
        for (Block block : blocks) {
            Block copy = new Block();
            for (Value arg : block.arguments()) {
                mapping.map(arg, copy.addArgument(arg.type(), arg.nameHint()));
            }
            copies.add(copy);
        }
        for (int i = 0; i < blocks.size(); i++) {
            Block copy = copies.get(i);
            for (Operation op : blocks.get(i).operations()) {
                copy.append(op.clone(mapping));
            }
            dest.addBlock(copy);
        }
    }
}

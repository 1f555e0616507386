package io.surfworks.parloops.text;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import io.surfworks.parloops.ir.Attributes.Attribute;
import io.surfworks.parloops.ir.Block;
import io.surfworks.parloops.ir.Function;
import io.surfworks.parloops.ir.IrTypes.Type;
import io.surfworks.parloops.ir.Module;
import io.surfworks.parloops.ir.Operation;
import io.surfworks.parloops.ir.Region;
import io.surfworks.parloops.ir.Value;

/**
 * Prints IR in the generic textual form accepted by {@link IrParser}.
 *
 * Function and block arguments are numbered {@code %arg0, %arg1, ...} and
 * operation results {@code %0, %1, ...} in program order, so printing the
 * same IR twice yields identical text.
 */
public final class IrPrinter {

    private static final String INDENT = "  ";

    private final StringBuilder sb = new StringBuilder();
    private final Map<Value, String> names = new IdentityHashMap<>();
    private int argCounter;
    private int valueCounter;
    private int blockCounter;

    private IrPrinter() {}

    public static String print(Module module) {
        IrPrinter printer = new IrPrinter();
        printer.sb.append("module @").append(module.name()).append(" {\n");
        for (Function function : module.functions()) {
            printer.printFunction(function, 1);
        }
        printer.sb.append("}\n");
        return printer.sb.toString();
    }

    public static String print(Function function) {
        IrPrinter printer = new IrPrinter();
        printer.printFunction(function, 0);
        return printer.sb.toString();
    }

    /**
     * Prints a single operation with its regions. Operands defined outside
     * the operation are shown as {@code %<unknown>}.
     */
    public static String print(Operation op) {
        IrPrinter printer = new IrPrinter();
        printer.printOperation(op, 0);
        return printer.sb.toString();
    }

    private void printFunction(Function function, int depth) {
        names.clear();
        argCounter = 0;
        valueCounter = 0;
        blockCounter = 0;

        String pad = INDENT.repeat(depth);
        sb.append(pad).append("func.func @").append(function.name()).append("(");
        List<Value> args = function.arguments();
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(nameArgument(args.get(i))).append(": ").append(args.get(i).type().toMlirString());
        }
        sb.append(") {\n");
        for (Operation op : function.body().operations()) {
            printOperation(op, depth + 1);
        }
        sb.append(pad).append("}\n");
    }

    private void printOperation(Operation op, int depth) {
        String pad = INDENT.repeat(depth);
        sb.append(pad);

        List<Value> results = op.results();
        if (!results.isEmpty()) {
            for (int i = 0; i < results.size(); i++) {
                if (i > 0) sb.append(", ");
                String name = "%" + valueCounter++;
                names.put(results.get(i), name);
                sb.append(name);
            }
            sb.append(" = ");
        }

        sb.append('"').append(op.name()).append("\"(");
        List<Value> operands = op.operands();
        for (int i = 0; i < operands.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(nameOf(operands.get(i)));
        }
        sb.append(")");

        if (op.numRegions() > 0) {
            sb.append(" (");
            for (int i = 0; i < op.numRegions(); i++) {
                if (i > 0) sb.append(", ");
                printRegion(op.region(i), depth);
            }
            sb.append(")");
        }

        Map<String, Attribute> attrs = op.attributes();
        if (!attrs.isEmpty()) {
            sb.append(" {");
            boolean first = true;
            for (Map.Entry<String, Attribute> e : attrs.entrySet()) {
                if (!first) sb.append(", ");
                first = false;
                sb.append(e.getKey()).append(" = ").append(e.getValue().toMlirString());
            }
            sb.append("}");
        }

        sb.append(" : (");
        for (int i = 0; i < operands.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(operands.get(i).type().toMlirString());
        }
        sb.append(") -> ");
        List<Type> resultTypes = op.resultTypes();
        if (resultTypes.size() == 1) {
            sb.append(resultTypes.get(0).toMlirString());
        } else {
            sb.append("(");
            for (int i = 0; i < resultTypes.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(resultTypes.get(i).toMlirString());
            }
            sb.append(")");
        }
        sb.append("\n");
    }

    private void printRegion(Region region, int depth) {
        String pad = INDENT.repeat(depth);
        sb.append("{\n");
        for (Block block : region.blocks()) {
            sb.append(pad).append("^bb").append(blockCounter++);
            if (block.numArguments() > 0) {
                sb.append("(");
                List<Value> args = block.arguments();
                for (int i = 0; i < args.size(); i++) {
                    if (i > 0) sb.append(", ");
                    sb.append(nameArgument(args.get(i))).append(": ").append(args.get(i).type().toMlirString());
                }
                sb.append(")");
            }
            sb.append(":\n");
            for (Operation op : block.operations()) {
                printOperation(op, depth + 1);
            }
        }
        sb.append(pad).append("}");
    }

    private String nameArgument(Value arg) {
        String name = "%arg" + argCounter++;
        names.put(arg, name);
        return name;
    }

    private String nameOf(Value value) {
        String name = names.get(value);
        return name != null ? name : "%<unknown>";
    }
}

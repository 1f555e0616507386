package io.surfworks.parloops.text;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.surfworks.parloops.dialect.StdOps;
import io.surfworks.parloops.ir.Attributes.Attribute;
import io.surfworks.parloops.ir.Attributes.BoolAttr;
import io.surfworks.parloops.ir.Attributes.DenseIntAttr;
import io.surfworks.parloops.ir.Attributes.FloatAttr;
import io.surfworks.parloops.ir.Attributes.IntegerAttr;
import io.surfworks.parloops.ir.Attributes.StringAttr;
import io.surfworks.parloops.ir.Block;
import io.surfworks.parloops.ir.Function;
import io.surfworks.parloops.ir.IrTypes;
import io.surfworks.parloops.ir.IrTypes.IndexType;
import io.surfworks.parloops.ir.IrTypes.MemRefType;
import io.surfworks.parloops.ir.IrTypes.ScalarType;
import io.surfworks.parloops.ir.IrTypes.Type;
import io.surfworks.parloops.ir.Location;
import io.surfworks.parloops.ir.Module;
import io.surfworks.parloops.ir.Operation;
import io.surfworks.parloops.ir.Value;
import io.surfworks.parloops.text.IrTokenizer.Token;
import io.surfworks.parloops.text.IrTokenizer.TokenType;

/**
 * Parser for the generic textual IR form.
 *
 * Implements a top-down recursive descent parser over:
 * <pre>{@code
 * module @name {
 *   func.func @f(%arg0: memref<2x3xf32>, %arg1: memref<f32>, %arg2: memref<2xf32>) {
 *     "lhlo.reduce"(%arg0, %arg1, %arg2) ({
 *     ^bb0(%lhs: memref<f32>, %rhs: memref<f32>, %res: memref<f32>):
 *       "lhlo.add"(%lhs, %rhs, %res) : (memref<f32>, memref<f32>, memref<f32>) -> ()
 *       "lhlo.terminator"() : () -> ()
 *     }) {dimensions = dense<[1]>} : (memref<2x3xf32>, memref<f32>, memref<2xf32>) -> ()
 *     "std.return"() : () -> ()
 *   }
 * }
 * }</pre>
 *
 * Values must be defined before they are used. Names defined inside a
 * region are visible only within it.
 */
public final class IrParser {

    private final List<Token> tokens;
    private final String sourceName;
    private int pos;
    private final Deque<Map<String, Value>> scopes = new ArrayDeque<>();

    public IrParser(List<Token> tokens, String sourceName) {
        this.tokens = tokens;
        this.sourceName = sourceName;
        this.pos = 0;
    }

    public static Module parse(String input) {
        return parse(input, "<input>");
    }

    /**
     * Parses a module; {@code sourceName} is used in operation locations.
     */
    public static Module parse(String input, String sourceName) {
        IrTokenizer tokenizer = new IrTokenizer(input);
        IrParser parser = new IrParser(tokenizer.tokenize(), sourceName);
        Module module = parser.parseModule();
        parser.expect(TokenType.EOF);
        return module;
    }

    // ==================== Module Parsing ====================

    /**
     * Parses {@code module @name { func... }}, or a bare sequence of functions.
     */
    public Module parseModule() {
        if (!checkIdentifier("module")) {
            List<Function> functions = new ArrayList<>();
            while (!check(TokenType.EOF)) {
                functions.add(parseFunction());
            }
            return new Module("module", functions);
        }
        expect(TokenType.IDENTIFIER, "module");
        String name = check(TokenType.AT_ID) ? parseAtId() : "module";
        expect(TokenType.LBRACE);

        List<Function> functions = new ArrayList<>();
        while (!check(TokenType.RBRACE) && !check(TokenType.EOF)) {
            functions.add(parseFunction());
        }

        expect(TokenType.RBRACE);
        return new Module(name, functions);
    }

    // ==================== Function Parsing ====================

    private Function parseFunction() {
        // func.func @name(%arg0: type, ...) { body }
        Token start = peek();
        if (checkIdentifier("func")) {
            advance();
        } else {
            expect(TokenType.IDENTIFIER, "func.func");
        }
        String name = parseAtId();
        expect(TokenType.LPAREN);

        scopes.clear();
        scopes.push(new HashMap<>());
        Block body = new Block();
        while (!check(TokenType.RPAREN)) {
            if (body.numArguments() > 0) {
                expect(TokenType.COMMA);
            }
            parseBlockArgument(body);
        }
        expect(TokenType.RPAREN);

        expect(TokenType.LBRACE);
        while (!check(TokenType.RBRACE)) {
            if (checkIdentifier("return")) {
                // Bare custom-form return
                Token ret = advance();
                body.append(Operation.create(StdOps.RETURN, location(ret), List.of(), List.of(), Map.of(), 0));
            } else {
                body.append(parseOperation());
            }
        }
        expect(TokenType.RBRACE);
        scopes.pop();

        return Function.withBody(name, body, location(start));
    }

    private void parseBlockArgument(Block block) {
        // %arg0: memref<4xf32>
        Token nameToken = peek();
        String name = parsePercentId();
        expect(TokenType.COLON);
        Type type = parseType();
        define(name, block.addArgument(type, name), nameToken);
    }

    // ==================== Operation Parsing ====================

    private Operation parseOperation() {
        // %a, %b = "dialect.op"(%x, %y) ({ regions }) {attrs} : (types) -> types
        List<Token> resultNames = new ArrayList<>();
        if (check(TokenType.PERCENT_ID)) {
            resultNames.add(advance());
            while (check(TokenType.COMMA)) {
                advance();
                resultNames.add(expect(TokenType.PERCENT_ID));
            }
            expect(TokenType.EQUALS);
        }

        Token nameToken = expect(TokenType.STRING);
        String opName = nameToken.value();
        if (opName.indexOf('.') < 0) {
            throw error("Operation name must be dialect-qualified: \"" + opName + "\"");
        }

        expect(TokenType.LPAREN);
        List<Value> operands = new ArrayList<>();
        while (!check(TokenType.RPAREN)) {
            if (!operands.isEmpty()) {
                expect(TokenType.COMMA);
            }
            operands.add(lookupValue(expect(TokenType.PERCENT_ID)));
        }
        expect(TokenType.RPAREN);

        List<List<Block>> regions = new ArrayList<>();
        if (check(TokenType.LPAREN)) {
            advance();
            regions.add(parseRegion());
            while (check(TokenType.COMMA)) {
                advance();
                regions.add(parseRegion());
            }
            expect(TokenType.RPAREN);
        }

        Map<String, Attribute> attributes = check(TokenType.LBRACE) ? parseAttributeDict() : Map.of();

        expect(TokenType.COLON);
        List<Type> operandTypes = parseTypeList();
        expect(TokenType.ARROW);
        List<Type> resultTypes = check(TokenType.LPAREN) ? parseTypeList() : List.of(parseType());

        if (operandTypes.size() != operands.size()) {
            throw error(String.format("\"%s\" has %d operands but %d operand types",
                    opName, operands.size(), operandTypes.size()));
        }
        for (int i = 0; i < operands.size(); i++) {
            if (!operands.get(i).type().equals(operandTypes.get(i))) {
                throw error(String.format("Operand %d of \"%s\" has type %s, declared %s", i, opName,
                        operands.get(i).type().toMlirString(), operandTypes.get(i).toMlirString()));
            }
        }
        if (resultTypes.size() != resultNames.size()) {
            throw error(String.format("\"%s\" defines %d names for %d results",
                    opName, resultNames.size(), resultTypes.size()));
        }

        Operation op = Operation.create(opName, location(nameToken), operands, resultTypes, attributes, regions.size());
        for (int i = 0; i < regions.size(); i++) {
            for (Block block : regions.get(i)) {
                op.region(i).addBlock(block);
            }
        }
        for (int i = 0; i < resultNames.size(); i++) {
            define(resultNames.get(i).value().substring(1), op.result(i), resultNames.get(i));
        }
        return op;
    }

    private List<Block> parseRegion() {
        // { ^bb0(%x: t): ops... } or { ops... }
        expect(TokenType.LBRACE);
        scopes.push(new HashMap<>());
        List<Block> blocks = new ArrayList<>();
        while (!check(TokenType.RBRACE)) {
            Block block = new Block();
            if (check(TokenType.CARET_ID)) {
                advance();
                if (check(TokenType.LPAREN)) {
                    advance();
                    while (!check(TokenType.RPAREN)) {
                        if (block.numArguments() > 0) {
                            expect(TokenType.COMMA);
                        }
                        parseBlockArgument(block);
                    }
                    expect(TokenType.RPAREN);
                }
                expect(TokenType.COLON);
            } else if (!blocks.isEmpty()) {
                throw error("Expected block label");
            }
            while (!check(TokenType.RBRACE) && !check(TokenType.CARET_ID)) {
                block.append(parseOperation());
            }
            blocks.add(block);
        }
        expect(TokenType.RBRACE);
        scopes.pop();
        return blocks;
    }

    // ==================== Attribute Parsing ====================

    private Map<String, Attribute> parseAttributeDict() {
        expect(TokenType.LBRACE);
        Map<String, Attribute> attributes = new LinkedHashMap<>();
        while (!check(TokenType.RBRACE)) {
            if (!attributes.isEmpty()) {
                expect(TokenType.COMMA);
            }
            Token key = check(TokenType.STRING) ? advance() : expect(TokenType.IDENTIFIER);
            expect(TokenType.EQUALS);
            if (attributes.put(key.value(), parseAttribute()) != null) {
                throw error("Duplicate attribute '" + key.value() + "'");
            }
        }
        expect(TokenType.RBRACE);
        return attributes;
    }

    private Attribute parseAttribute() {
        Token t = peek();
        Attribute attr;
        if (check(TokenType.INTEGER)) {
            attr = new IntegerAttr(parseLong(advance()));
        } else if (check(TokenType.FLOAT)) {
            attr = new FloatAttr(parseDouble(advance()));
        } else if (check(TokenType.STRING)) {
            attr = new StringAttr(advance().value());
        } else if (checkIdentifier("true") || checkIdentifier("false")) {
            attr = new BoolAttr(Boolean.parseBoolean(advance().value()));
        } else if (checkIdentifier("inf") || checkIdentifier("nan")) {
            attr = new FloatAttr(parseDouble(advance()));
        } else if (checkIdentifier("dense")) {
            attr = parseDense();
        } else {
            throw error("Expected attribute value, got " + t.type() + " (" + t.value() + ")");
        }
        // Optional type suffix: 0 : index, 1.0 : f32
        if (check(TokenType.COLON)) {
            advance();
            parseType();
        }
        return attr;
    }

    private DenseIntAttr parseDense() {
        // dense<[1, 2]>, dense<[[0, 0], [1, 1]]>, dense<3>
        expect(TokenType.IDENTIFIER, "dense");
        expect(TokenType.LANGLE);
        DenseIntAttr attr;
        if (check(TokenType.INTEGER)) {
            attr = DenseIntAttr.vector(parseLong(advance()));
        } else {
            expect(TokenType.LBRACKET);
            if (check(TokenType.LBRACKET)) {
                List<Long> values = new ArrayList<>();
                int rows = 0;
                int cols = -1;
                while (!check(TokenType.RBRACKET)) {
                    if (rows > 0) {
                        expect(TokenType.COMMA);
                    }
                    List<Long> row = parseIntegerList();
                    if (cols >= 0 && row.size() != cols) {
                        throw error("Ragged dense attribute: rows of " + cols + " and " + row.size());
                    }
                    cols = row.size();
                    values.addAll(row);
                    rows++;
                }
                expect(TokenType.RBRACKET);
                attr = new DenseIntAttr(values, List.of(rows, Math.max(cols, 0)));
            } else {
                List<Long> values = new ArrayList<>();
                while (!check(TokenType.RBRACKET)) {
                    if (!values.isEmpty()) {
                        expect(TokenType.COMMA);
                    }
                    values.add(parseLong(expect(TokenType.INTEGER)));
                }
                expect(TokenType.RBRACKET);
                attr = DenseIntAttr.vector(values);
            }
        }
        expect(TokenType.RANGLE);
        return attr;
    }

    private List<Long> parseIntegerList() {
        expect(TokenType.LBRACKET);
        List<Long> values = new ArrayList<>();
        while (!check(TokenType.RBRACKET)) {
            if (!values.isEmpty()) {
                expect(TokenType.COMMA);
            }
            values.add(parseLong(expect(TokenType.INTEGER)));
        }
        expect(TokenType.RBRACKET);
        return values;
    }

    // ==================== Type Parsing ====================

    private List<Type> parseTypeList() {
        expect(TokenType.LPAREN);
        List<Type> types = new ArrayList<>();
        while (!check(TokenType.RPAREN)) {
            if (!types.isEmpty()) {
                expect(TokenType.COMMA);
            }
            types.add(parseType());
        }
        expect(TokenType.RPAREN);
        return types;
    }

    private Type parseType() {
        if (checkIdentifier("memref")) {
            return parseMemRefType();
        }
        if (checkIdentifier("index")) {
            advance();
            return IndexType.INSTANCE;
        }
        Token t = expect(TokenType.IDENTIFIER);
        if (!ScalarType.isScalarName(t.value())) {
            throw new IrParseException("Unknown type '" + t.value() + "'", t.line(), t.column());
        }
        return ScalarType.of(t.value());
    }

    private MemRefType parseMemRefType() {
        // memref<4x?xf32> arrives as INTEGER(4) IDENTIFIER(x) QUESTION IDENTIFIER(xf32)
        expect(TokenType.IDENTIFIER, "memref");
        Token open = expect(TokenType.LANGLE);
        StringBuilder spelled = new StringBuilder();
        while (!check(TokenType.RANGLE)) {
            if (!check(TokenType.INTEGER) && !check(TokenType.IDENTIFIER) && !check(TokenType.QUESTION)) {
                throw error("Unexpected " + peek().type() + " in memref type");
            }
            spelled.append(advance().value());
        }
        expect(TokenType.RANGLE);

        String[] parts = spelled.toString().split("x", -1);
        String element = parts[parts.length - 1];
        if (!ScalarType.isScalarName(element)) {
            throw new IrParseException("Invalid memref element type in memref<" + spelled + ">",
                    open.line(), open.column());
        }
        List<Long> shape = new ArrayList<>();
        for (int i = 0; i < parts.length - 1; i++) {
            String dim = parts[i];
            if (dim.equals("?")) {
                shape.add(IrTypes.DYNAMIC);
            } else if (!dim.isEmpty() && dim.chars().allMatch(Character::isDigit)) {
                shape.add(Long.parseLong(dim));
            } else {
                throw new IrParseException("Invalid memref dimension '" + dim + "' in memref<" + spelled + ">",
                        open.line(), open.column());
            }
        }
        return new MemRefType(shape, ScalarType.of(element));
    }

    // ==================== Helpers ====================

    private String parsePercentId() {
        Token t = expect(TokenType.PERCENT_ID);
        return t.value().substring(1); // Remove leading %
    }

    private String parseAtId() {
        Token t = expect(TokenType.AT_ID);
        return t.value().substring(1); // Remove leading @
    }

    private void define(String name, Value value, Token at) {
        for (Map<String, Value> scope : scopes) {
            if (scope.containsKey(name)) {
                throw new IrParseException("Redefinition of %" + name, at.line(), at.column());
            }
        }
        scopes.peek().put(name, value);
    }

    private Value lookupValue(Token t) {
        String name = t.value().substring(1);
        for (Map<String, Value> scope : scopes) {
            Value v = scope.get(name);
            if (v != null) {
                return v;
            }
        }
        throw new IrParseException("Undefined value: %" + name, t.line(), t.column());
    }

    private long parseLong(Token t) {
        try {
            return Long.parseLong(t.value());
        } catch (NumberFormatException e) {
            throw new IrParseException("Invalid integer '" + t.value() + "'", t.line(), t.column());
        }
    }

    private double parseDouble(Token t) {
        return switch (t.value()) {
            case "inf" -> Double.POSITIVE_INFINITY;
            case "-inf" -> Double.NEGATIVE_INFINITY;
            case "nan" -> Double.NaN;
            default -> {
                try {
                    yield Double.parseDouble(t.value());
                } catch (NumberFormatException e) {
                    throw new IrParseException("Invalid float '" + t.value() + "'", t.line(), t.column());
                }
            }
        };
    }

    private Location location(Token t) {
        return Location.of(sourceName, t.line(), t.column());
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token advance() {
        return tokens.get(pos++);
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean checkIdentifier(String value) {
        Token t = peek();
        return t.type() == TokenType.IDENTIFIER && t.value().equals(value);
    }

    private Token expect(TokenType type) {
        Token t = peek();
        if (t.type() != type) {
            throw error("Expected " + type + ", got " + t.type() + " (" + t.value() + ")");
        }
        return advance();
    }

    private Token expect(TokenType type, String value) {
        Token t = peek();
        if (t.type() != type || !t.value().equals(value)) {
            throw error("Expected " + type + "(" + value + "), got " + t.type() + "(" + t.value() + ")");
        }
        return advance();
    }

    private IrParseException error(String message) {
        Token t = peek();
        return new IrParseException(message, t.line(), t.column());
    }
}

package org.pl0vm.compiler.frontend.parser;

import org.pl0vm.compiler.api.CompilationException;
import org.pl0vm.compiler.api.CompilerErrorCode;
import org.pl0vm.compiler.api.CompilerOptions;
import org.pl0vm.compiler.frontend.lexer.Token;
import org.pl0vm.compiler.frontend.lexer.TokenType;
import org.pl0vm.compiler.frontend.parser.ast.AssignNode;
import org.pl0vm.compiler.frontend.parser.ast.AstNode;
import org.pl0vm.compiler.frontend.parser.ast.BinaryOpNode;
import org.pl0vm.compiler.frontend.parser.ast.BlockNode;
import org.pl0vm.compiler.frontend.parser.ast.CallNode;
import org.pl0vm.compiler.frontend.parser.ast.CompoundNode;
import org.pl0vm.compiler.frontend.parser.ast.ConstantRefNode;
import org.pl0vm.compiler.frontend.parser.ast.EmptyStatementNode;
import org.pl0vm.compiler.frontend.parser.ast.FixedPointConvertNode;
import org.pl0vm.compiler.frontend.parser.ast.IfNode;
import org.pl0vm.compiler.frontend.parser.ast.NumberLiteralNode;
import org.pl0vm.compiler.frontend.parser.ast.PeekNode;
import org.pl0vm.compiler.frontend.parser.ast.PokeNode;
import org.pl0vm.compiler.frontend.parser.ast.PopNode;
import org.pl0vm.compiler.frontend.parser.ast.ProgramNode;
import org.pl0vm.compiler.frontend.parser.ast.PushNode;
import org.pl0vm.compiler.frontend.parser.ast.UnaryIntrinsicNode;
import org.pl0vm.compiler.frontend.parser.ast.VarDeclNode;
import org.pl0vm.compiler.frontend.parser.ast.VariableRefNode;
import org.pl0vm.compiler.frontend.parser.ast.WhileNode;
import org.pl0vm.compiler.frontend.semantics.AddressAllocator;
import org.pl0vm.compiler.frontend.semantics.LabelGenerator;
import org.pl0vm.compiler.frontend.semantics.SymbolTable;
import org.pl0vm.runtime.isa.AddressOperand;
import org.pl0vm.runtime.isa.ImmediateOperand;
import org.pl0vm.runtime.isa.IndirectOperand;
import org.pl0vm.runtime.isa.Instruction;
import org.pl0vm.runtime.isa.LabelOperand;
import org.pl0vm.runtime.isa.Opcode;
import org.pl0vm.runtime.isa.ProgramOperand;
import org.pl0vm.runtime.isa.RegisterOperand;
import org.pl0vm.runtime.math.FixedPointCodec;
import org.pl0vm.runtime.math.MathOp;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Recursive-descent parser and code generator for PL/0. Each production returns its
 * AST fragment together with the instructions emitted for it; fragments are
 * concatenated bottom-up.
 * <p>
 * Every expression leaves its value in {@code r0}. A binary operation spills its left
 * operand into a fresh temporary cell, evaluates the right operand, and reloads the left
 * one into {@code r1}. Subtraction and division compute {@code r1 OP r0} and move the
 * result back into {@code r0} through the same cell.
 * <p>
 * The parser stops at the first error.
 */
public class Parser {

    private static final RegisterOperand R0 = new RegisterOperand(0);
    private static final RegisterOperand R1 = new RegisterOperand(1);
    private static final IndirectOperand AT_R0 = new IndirectOperand(0);

    private static final Map<String, Double> CONSTANTS = Map.of(
            "pi", Math.PI,
            "tau", Math.PI * 2,
            "e", Math.E);

    private final List<Token> tokens;
    private final CompilerOptions options;
    private final Predicate<String> knownPrograms;
    private final AddressAllocator allocator;
    private final SymbolTable symbols;
    private final LabelGenerator labels = new LabelGenerator();
    private int current = 0;
    private String programName;

    /**
     * Constructs a new Parser.
     * @param tokens The tokens to parse, terminated by {@link TokenType#END_OF_INPUT}.
     * @param options The compiler options.
     * @param baseAddress The address of the first variable.
     * @param knownPrograms Accepts the program names a {@code call} may target, besides the program itself.
     */
    public Parser(List<Token> tokens, CompilerOptions options, int baseAddress, Predicate<String> knownPrograms) {
        this.tokens = tokens;
        this.options = options;
        this.knownPrograms = knownPrograms;
        this.allocator = new AddressAllocator(baseAddress, options.memorySize());
        this.symbols = new SymbolTable(allocator);
    }

    /**
     * {@code program := 'program' ident ';' block '.'}
     * @return The program node and the code of its block, without the trailing return.
     * @throws CompilationException at the first error.
     */
    public Parsed parseProgram() throws CompilationException {
        consumeKeyword("program");
        Token name = consume(TokenType.IDENTIFIER, "program name");
        programName = name.text();
        consumeSymbol(";");
        Parsed block = parseBlock();
        consumeSymbol(".");
        if (!isAtEnd()) {
            throw unexpected("end of input after '.'");
        }
        return new Parsed(new ProgramNode(name.text(), (BlockNode) block.node()), block.code());
    }

    /**
     * {@code block := varDecl? statement}
     */
    private Parsed parseBlock() throws CompilationException {
        List<VarDeclNode> declarations = new ArrayList<>();
        if (peek().isKeyword("var")) {
            declarations = parseVarDecl();
        }
        Parsed statement = parseStatement();
        return new Parsed(new BlockNode(declarations, statement.node()), statement.code());
    }

    /**
     * {@code varDecl := 'var' ident (',' ident)* ';'}
     */
    private List<VarDeclNode> parseVarDecl() throws CompilationException {
        consumeKeyword("var");
        List<VarDeclNode> declarations = new ArrayList<>();
        do {
            Token name = consume(TokenType.IDENTIFIER, "variable name");
            declarations.add(new VarDeclNode(name.text(), symbols.declare(name)));
        } while (matchSymbol(","));
        consumeSymbol(";");
        return declarations;
    }

    private Parsed parseStatement() throws CompilationException {
        Token token = peek();
        if (token.type() == TokenType.KEYWORD) {
            switch ((String) token.value()) {
                case "call": return parseCall();
                case "if": return parseIf();
                case "while": return parseWhile();
                case "begin": return parseCompound();
                case "push": return parsePush();
                case "pop": return parsePop();
                case "peek": return parsePeek();
                case "poke": return parsePoke();
                default: break;
            }
        }
        if (token.type() == TokenType.IDENTIFIER) {
            return parseAssignment();
        }
        return new Parsed(new EmptyStatementNode(), List.of());
    }

    private Parsed parseAssignment() throws CompilationException {
        Token name = consume(TokenType.IDENTIFIER, "variable name");
        consumeSymbol(":=");
        Parsed expression = parseExpression();
        consumeSymbol(";");
        int address = symbols.resolve(name);
        List<Instruction> code = new ArrayList<>(expression.code());
        code.add(Instruction.of(Opcode.STORE, R0, new AddressOperand(address)));
        return new Parsed(new AssignNode(name.text(), expression.node()), code);
    }

    private Parsed parseCall() throws CompilationException {
        consumeKeyword("call");
        Token name = consume(TokenType.IDENTIFIER, "program name");
        consumeSymbol(";");
        if (!name.text().equals(programName) && !knownPrograms.test(name.text())) {
            throw new CompilationException(CompilerErrorCode.UNKNOWN_PROGRAM,
                    "Unknown program '" + name.text() + "'", name.sourceInfo());
        }
        return new Parsed(new CallNode(name.text()),
                List.of(Instruction.of(Opcode.PL0CALL, new ProgramOperand(name.text()))));
    }

    private Parsed parseIf() throws CompilationException {
        consumeKeyword("if");
        Parsed condition = parseExpression();
        consumeKeyword("then");
        Parsed body = parseStatement();
        String skip = labels.next();

        List<Instruction> code = new ArrayList<>(condition.code());
        code.add(Instruction.of(Opcode.JZ, R0, new LabelOperand(skip)));
        code.addAll(body.code());
        code.add(Instruction.label(skip));
        return new Parsed(new IfNode(condition.node(), body.node()), code);
    }

    private Parsed parseWhile() throws CompilationException {
        consumeKeyword("while");
        String start = labels.next();
        String exit = labels.next();
        Parsed condition = parseExpression();
        consumeKeyword("do");
        Parsed body = parseStatement();

        List<Instruction> code = new ArrayList<>();
        code.add(Instruction.label(start));
        code.addAll(condition.code());
        code.add(Instruction.of(Opcode.JZ, R0, new LabelOperand(exit)));
        code.addAll(body.code());
        code.add(Instruction.of(Opcode.JMP, new LabelOperand(start)));
        code.add(Instruction.label(exit));
        return new Parsed(new WhileNode(condition.node(), body.node()), code);
    }

    /**
     * {@code compound := 'begin' statement (';' statement)* 'end'}; separators are optional
     * since assignments and the other simple statements carry their own {@code ;}.
     */
    private Parsed parseCompound() throws CompilationException {
        consumeKeyword("begin");
        List<AstNode> statements = new ArrayList<>();
        List<Instruction> code = new ArrayList<>();
        while (!peek().isKeyword("end")) {
            if (isAtEnd()) {
                throw unexpected("'end'");
            }
            int before = current;
            Parsed statement = parseStatement();
            statements.add(statement.node());
            code.addAll(statement.code());
            matchSymbol(";");
            if (current == before) {
                throw unexpected("statement or 'end'");
            }
        }
        consumeKeyword("end");
        return new Parsed(new CompoundNode(statements), code);
    }

    private Parsed parsePush() throws CompilationException {
        consumeKeyword("push");
        Token name = consume(TokenType.IDENTIFIER, "variable name");
        consumeSymbol(";");
        int address = symbols.resolve(name);
        return new Parsed(new PushNode(name.text()), List.of(
                Instruction.of(Opcode.LOAD, R0, new AddressOperand(address)),
                Instruction.of(Opcode.PUSH, R0)));
    }

    private Parsed parsePop() throws CompilationException {
        consumeKeyword("pop");
        Token name = consume(TokenType.IDENTIFIER, "variable name");
        consumeSymbol(";");
        int address = symbols.resolve(name);
        return new Parsed(new PopNode(name.text()), List.of(
                Instruction.of(Opcode.POP, R0),
                Instruction.of(Opcode.STORE, R0, new AddressOperand(address))));
    }

    private Parsed parsePeek() throws CompilationException {
        consumeKeyword("peek");
        consumeSymbol("(");
        Token destination = consume(TokenType.IDENTIFIER, "variable name");
        consumeSymbol(",");
        Token address = consume(TokenType.IDENTIFIER, "variable name");
        consumeSymbol(")");
        consumeSymbol(";");
        int destinationAddress = symbols.resolve(destination);
        int pointerAddress = symbols.resolve(address);
        return new Parsed(new PeekNode(destination.text(), address.text()), List.of(
                Instruction.of(Opcode.LOAD, R0, new AddressOperand(pointerAddress)),
                Instruction.of(Opcode.PEEK, R1, AT_R0),
                Instruction.of(Opcode.STORE, R1, new AddressOperand(destinationAddress))));
    }

    private Parsed parsePoke() throws CompilationException {
        consumeKeyword("poke");
        consumeSymbol("(");
        Token address = consume(TokenType.IDENTIFIER, "variable name");
        consumeSymbol(",");
        Token value = consume(TokenType.IDENTIFIER, "variable name");
        consumeSymbol(")");
        consumeSymbol(";");
        int pointerAddress = symbols.resolve(address);
        int valueAddress = symbols.resolve(value);
        return new Parsed(new PokeNode(address.text(), value.text()), List.of(
                Instruction.of(Opcode.LOAD, R0, new AddressOperand(pointerAddress)),
                Instruction.of(Opcode.LOAD, R1, new AddressOperand(valueAddress)),
                Instruction.of(Opcode.POKE, R1, AT_R0)));
    }

    /**
     * {@code expr := term (('+'|'-') term)*}
     */
    private Parsed parseExpression() throws CompilationException {
        Parsed left = parseTerm();
        while (peek().isSymbol("+") || peek().isSymbol("-")) {
            Token operator = advance();
            Parsed right = parseTerm();
            left = binary(operator, left, right);
        }
        return left;
    }

    /**
     * {@code term := factor (('*'|'/') factor)*}
     */
    private Parsed parseTerm() throws CompilationException {
        Parsed left = parseFactor();
        while (peek().isSymbol("*") || peek().isSymbol("/")) {
            Token operator = advance();
            Parsed right = parseFactor();
            left = binary(operator, left, right);
        }
        return left;
    }

    private Parsed binary(Token operator, Parsed left, Parsed right) throws CompilationException {
        char op = operator.text().charAt(0);
        AddressOperand temp = new AddressOperand(allocator.allocateTemporary(operator));

        List<Instruction> code = new ArrayList<>(left.code());
        code.add(Instruction.of(Opcode.STORE, R0, temp));
        code.addAll(right.code());
        code.add(Instruction.of(Opcode.LOAD, R1, temp));
        switch (op) {
            case '+' -> code.add(Instruction.of(Opcode.ADD, R0, R1));
            case '*' -> code.add(Instruction.of(Opcode.MUL, R0, R1));
            case '-', '/' -> {
                code.add(Instruction.of(op == '-' ? Opcode.SUB : Opcode.DIV, R1, R0));
                code.add(Instruction.of(Opcode.STORE, R1, temp));
                code.add(Instruction.of(Opcode.LOAD, R0, temp));
            }
            default -> throw new IllegalStateException("Not a binary operator: " + op);
        }
        return new Parsed(new BinaryOpNode(op, left.node(), right.node()), code);
    }

    /**
     * {@code factor := number | float | ident ['(' expr ')'] | '(' expr ')'}
     */
    private Parsed parseFactor() throws CompilationException {
        Token token = peek();

        if (token.type() == TokenType.NUMBER) {
            advance();
            int value = (Integer) token.value();
            return new Parsed(new NumberLiteralNode(value, token.text(), false),
                    List.of(loadImmediate(value)));
        }

        if (token.type() == TokenType.FLOAT) {
            advance();
            int scaled = FixedPointCodec.encode((Double) token.value(), options.scale());
            return new Parsed(new NumberLiteralNode(scaled, token.text(), true),
                    List.of(loadImmediate(scaled)));
        }

        if (token.type() == TokenType.IDENTIFIER) {
            if (checkNextSymbol("(")) {
                return parseCallLike();
            }
            advance();
            String name = token.text();
            String lower = name.toLowerCase(Locale.ROOT);
            if (!symbols.isDeclared(name) && CONSTANTS.containsKey(lower)) {
                int scaled = FixedPointCodec.encode(CONSTANTS.get(lower), options.scale());
                return new Parsed(new ConstantRefNode(lower, scaled), List.of(loadImmediate(scaled)));
            }
            int address = symbols.resolve(token);
            return new Parsed(new VariableRefNode(name, address),
                    List.of(Instruction.of(Opcode.LOAD, R0, new AddressOperand(address))));
        }

        if (token.isSymbol("(")) {
            advance();
            Parsed inner = parseExpression();
            consumeSymbol(")");
            return inner;
        }

        throw unexpected("number, variable or '('");
    }

    /**
     * {@code ident '(' expr ')'}: a math intrinsic or a fixed-point conversion.
     */
    private Parsed parseCallLike() throws CompilationException {
        Token name = advance();
        consumeSymbol("(");
        Parsed argument = parseExpression();
        consumeSymbol(")");
        String lower = name.text().toLowerCase(Locale.ROOT);

        Optional<MathOp> intrinsic = MathOp.forIntrinsicName(lower);
        if (intrinsic.isPresent()) {
            List<Instruction> code = new ArrayList<>(argument.code());
            code.add(Instruction.of(intrinsic.get().opcode(), R0));
            return new Parsed(new UnaryIntrinsicNode(name.text(), intrinsic.get(), argument.node()), code);
        }

        switch (lower) {
            case "fx", "tofx" -> {
                AddressOperand temp = new AddressOperand(allocator.allocateTemporary(name));
                List<Instruction> code = new ArrayList<>(argument.code());
                code.add(Instruction.of(Opcode.STORE, R0, temp));
                code.add(loadImmediate(options.scale()));
                code.add(Instruction.of(Opcode.LOAD, R1, temp));
                code.add(Instruction.of(Opcode.MUL, R0, R1));
                return new Parsed(new FixedPointConvertNode(true, argument.node()), code);
            }
            case "int", "fromfx", "unfx" -> {
                List<Instruction> code = new ArrayList<>(argument.code());
                code.add(Instruction.of(Opcode.LOAD, R1, new ImmediateOperand(options.scale())));
                code.add(Instruction.of(Opcode.DIV, R0, R1));
                return new Parsed(new FixedPointConvertNode(false, argument.node()), code);
            }
            default -> {
                List<String> supported = new ArrayList<>();
                MathOp.intrinsicNames().forEach(supported::add);
                supported.add("fx");
                supported.add("int");
                throw new CompilationException(CompilerErrorCode.UNKNOWN_INTRINSIC,
                        "Unknown intrinsic '" + name.text() + "(...)'. Supported: " + String.join(", ", supported),
                        name.sourceInfo());
            }
        }
    }

    private static Instruction loadImmediate(int value) {
        return Instruction.of(Opcode.LOAD, R0, new ImmediateOperand(value));
    }

    /**
     * @return The variables declared so far, name to address, in declaration order.
     */
    public Map<String, Integer> getVariables() {
        return new LinkedHashMap<>(symbols.asMap());
    }

    /**
     * @return The number of temporary cells allocated so far.
     */
    public int getTemporariesUsed() {
        return allocator.temporariesUsed();
    }

    // region token helpers

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_INPUT;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private boolean checkNextSymbol(String symbol) {
        return current + 1 < tokens.size() && tokens.get(current + 1).isSymbol(symbol);
    }

    private Token advance() {
        Token token = peek();
        if (!isAtEnd()) current++;
        return token;
    }

    private boolean matchSymbol(String symbol) {
        if (peek().isSymbol(symbol)) {
            advance();
            return true;
        }
        return false;
    }

    private Token consume(TokenType type, String expected) throws CompilationException {
        if (peek().type() == type) return advance();
        throw unexpected(expected);
    }

    private void consumeKeyword(String keyword) throws CompilationException {
        if (!peek().isKeyword(keyword)) {
            throw unexpected("'" + keyword + "'");
        }
        advance();
    }

    private void consumeSymbol(String symbol) throws CompilationException {
        if (!peek().isSymbol(symbol)) {
            throw unexpected("'" + symbol + "'");
        }
        advance();
    }

    private CompilationException unexpected(String expected) {
        Token token = peek();
        return new CompilationException(CompilerErrorCode.UNEXPECTED_TOKEN,
                "Expected " + expected + ", got " + token.describe(), token.sourceInfo());
    }

    // endregion
}

package com.scratchparser;

import com.scratchparser.UnknownOperatorException.OperatorKind;
import com.scratchparser.ast.*;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * LL(1) recursive-descent parser. Holds a single lookahead token and pulls the next one from
 * its {@link TokenSource} only when the current one is consumed.
 *
 * <p>Grammar productions are noted above each method. The first error aborts the parse.</p>
 */
public class Parser {

    private final TokenSource tokens;
    private Token lookahead;

    public Parser(String source) {
        this(new Lexer(source));
    }

    public Parser(TokenSource tokens) {
        this.tokens = tokens;
    }

    public static Program parse(String source) {
        return new Parser(source).parse();
    }

    public Program parse() {
        lookahead = tokens.nextToken();
        return parseProgram();
    }

    // ========================================================================
    // Statements
    // ========================================================================

    // Program
    //   : StatementList
    //   ;
    private Program parseProgram() {
        return new Program(parseStatementList(TokenType.EOF));
    }

    // StatementList
    //   : Statement
    //   | StatementList Statement
    //   ;
    private List<Statement> parseStatementList(TokenType stop) {
        List<Statement> statements = new ArrayList<>();
        do {
            // An unclosed list reports its closing token, not a missing expression
            if (stop != TokenType.EOF && check(TokenType.EOF)) {
                throw new UnexpectedEndOfInputException(stop);
            }
            statements.add(parseStatement());
        } while (!check(stop));
        return statements;
    }

    private Statement parseStatement() {
        switch (lookahead.type()) {
            case SEMICOLON:
                return parseEmptyStatement();
            case OPEN_CURLY:
                return parseBlockStatement();
            case LET:
                return parseVariableStatement();
            case IF:
                return parseIfStatement();
            case WHILE:
            case DO:
            case FOR:
                return parseIterationStatement();
            case DEF:
                return parseFunctionDeclaration();
            case CLASS:
                return parseClassDeclaration();
            case RETURN:
                return parseReturnStatement();
            default:
                return parseExpressionStatement();
        }
    }

    // ExprStmt
    //   : SeqExpr ';'
    //   ;
    private ExprStmt parseExpressionStatement() {
        Expression expr = parseSequenceExpression();
        consume(TokenType.SEMICOLON);
        return new ExprStmt(expr);
    }

    // BlockStmt
    //   : '{' OptStatementList '}'
    //   ;
    private BlockStmt parseBlockStatement() {
        consume(TokenType.OPEN_CURLY);
        List<Statement> body = check(TokenType.CLOSE_CURLY)
            ? List.of()
            : parseStatementList(TokenType.CLOSE_CURLY);
        consume(TokenType.CLOSE_CURLY);
        return new BlockStmt(body);
    }

    private EmptyStmt parseEmptyStatement() {
        consume(TokenType.SEMICOLON);
        return new EmptyStmt();
    }

    // VarStmt
    //   : VarStmtInit ';'
    //   ;
    private VarStmt parseVariableStatement() {
        VarStmt stmt = parseVariableStatementInit();
        consume(TokenType.SEMICOLON);
        return stmt;
    }

    // VarStmtInit
    //   : 'let' VarDeclList
    //   ;
    private VarStmt parseVariableStatementInit() {
        consume(TokenType.LET);
        List<VarDecl> decls = new ArrayList<>();
        do {
            decls.add(parseVariableDeclaration());
        } while (match(TokenType.COMMA));
        return new VarStmt(decls);
    }

    // VarDecl
    //   : Identifier
    //   | Identifier '=' AssignExpr
    //   ;
    private VarDecl parseVariableDeclaration() {
        Identifier id = parseIdentifier();
        Expression init = null;
        if (!check(TokenType.COMMA) && !check(TokenType.SEMICOLON)) {
            consume(TokenType.SIMPLE_ASSIGN);
            init = parseAssignmentExpression();
        }
        return new VarDecl(id, init);
    }

    // IfStmt
    //   : 'if' '(' SeqExpr ')' Statement
    //   | 'if' '(' SeqExpr ')' Statement 'else' Statement
    //   ;
    private IfStmt parseIfStatement() {
        consume(TokenType.IF);
        Expression cond = parseParenthesizedCondition();
        Statement cons = parseStatement();
        Statement alt = null;
        if (match(TokenType.ELSE)) {
            alt = parseStatement();
        }
        return new IfStmt(cond, cons, alt);
    }

    private Statement parseIterationStatement() {
        switch (lookahead.type()) {
            case WHILE:
                return parseWhileStatement();
            case DO:
                return parseDoWhileStatement();
            case FOR:
                return parseForStatement();
            default:
                throw new UnexpectedTokenException(lookahead, TokenType.WHILE);
        }
    }

    // WhileStmt
    //   : 'while' '(' SeqExpr ')' Statement
    //   ;
    private WhileStmt parseWhileStatement() {
        consume(TokenType.WHILE);
        Expression cond = parseParenthesizedCondition();
        Statement body = parseStatement();
        return new WhileStmt(cond, body);
    }

    // DoWhileStmt
    //   : 'do' Statement 'while' '(' SeqExpr ')' ';'
    //   ;
    private DoWhileStmt parseDoWhileStatement() {
        consume(TokenType.DO);
        Statement body = parseStatement();
        consume(TokenType.WHILE);
        Expression cond = parseParenthesizedCondition();
        consume(TokenType.SEMICOLON);
        return new DoWhileStmt(cond, body);
    }

    // ForStmt
    //   : 'for' '(' OptForInit ';' OptSeqExpr ';' OptSeqExpr ')' Statement
    //   ;
    //
    // ForInit
    //   : VarStmtInit
    //   | SeqExpr
    //   ;
    private ForStmt parseForStatement() {
        consume(TokenType.FOR);
        consume(TokenType.OPEN_PAREN);

        Node init = null;
        if (!check(TokenType.SEMICOLON)) {
            init = check(TokenType.LET) ? parseVariableStatementInit() : parseSequenceExpression();
        }
        consume(TokenType.SEMICOLON);

        Expression cond = check(TokenType.SEMICOLON) ? null : parseSequenceExpression();
        consume(TokenType.SEMICOLON);

        Expression step = check(TokenType.CLOSE_PAREN) ? null : parseSequenceExpression();
        consume(TokenType.CLOSE_PAREN);

        Statement body = parseStatement();
        return new ForStmt(init, cond, step, body);
    }

    private Expression parseParenthesizedCondition() {
        consume(TokenType.OPEN_PAREN);
        Expression cond = parseSequenceExpression();
        consume(TokenType.CLOSE_PAREN);
        return cond;
    }

    // FuncDecl
    //   : 'def' Identifier '(' OptFormalParamList ')' BlockStmt
    //   ;
    private FuncDecl parseFunctionDeclaration() {
        consume(TokenType.DEF);
        Identifier name = parseIdentifier();
        consume(TokenType.OPEN_PAREN);

        List<Identifier> params = null;
        if (!check(TokenType.CLOSE_PAREN)) {
            params = new ArrayList<>();
            do {
                params.add(parseIdentifier());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.CLOSE_PAREN);

        BlockStmt body = parseBlockStatement();
        return new FuncDecl(name, params, body);
    }

    // ReturnStmt
    //   : 'return' OptSeqExpr ';'
    //   ;
    private ReturnStmt parseReturnStatement() {
        consume(TokenType.RETURN);
        Expression arg = check(TokenType.SEMICOLON) ? null : parseSequenceExpression();
        consume(TokenType.SEMICOLON);
        return new ReturnStmt(arg);
    }

    // ClassDecl
    //   : 'class' Identifier OptClassExtends BlockStmt
    //   ;
    //
    // ClassExtends
    //   : 'extends' Identifier
    //   ;
    private ClassDecl parseClassDeclaration() {
        consume(TokenType.CLASS);
        Identifier id = parseIdentifier();
        Identifier superClass = null;
        if (match(TokenType.EXTENDS)) {
            superClass = parseIdentifier();
        }
        BlockStmt body = parseBlockStatement();
        return new ClassDecl(id, superClass, body);
    }

    // ========================================================================
    // Expressions, loosest to tightest
    // ========================================================================

    // SeqExpr
    //   : Expr
    //   | SeqExpr ',' Expr
    //   ;
    private Expression parseSequenceExpression() {
        List<Expression> body = new ArrayList<>();
        do {
            body.add(parseAssignmentExpression());
        } while (match(TokenType.COMMA));

        if (body.size() == 1) {
            return body.get(0);
        }
        return new SeqExpr(body);
    }

    // AssignExpr
    //   : LogicalOrExpr
    //   | LeftHandSideExpr AssignOp AssignExpr
    //   ;
    private Expression parseAssignmentExpression() {
        Expression left = parseLogicalOrExpression();
        if (!check(TokenType.SIMPLE_ASSIGN) && !check(TokenType.COMPLEX_ASSIGN)) {
            return left;
        }

        Token opToken = consume(lookahead.type());
        AssignOperator op = AssignOperator.fromSymbol(opToken.value());
        if (op == AssignOperator.INVALID) {
            throw new UnknownOperatorException(OperatorKind.ASSIGN, opToken.value());
        }
        if (!(left instanceof Identifier) && !(left instanceof MemberExpr)) {
            throw new InvalidLvalueException(left);
        }

        // Right-associative
        Expression right = parseAssignmentExpression();
        return new AssignExpr(op, left, right);
    }

    private Expression parseLogicalOrExpression() {
        return parseLogicalExpression(this::parseLogicalAndExpression, TokenType.OR_OP);
    }

    private Expression parseLogicalAndExpression() {
        return parseLogicalExpression(this::parseEqualityExpression, TokenType.AND_OP);
    }

    private Expression parseEqualityExpression() {
        return parseBinaryExpression(this::parseRelationalExpression, TokenType.EQUALITY_OP);
    }

    private Expression parseRelationalExpression() {
        return parseBinaryExpression(this::parseAdditiveExpression, TokenType.RELATIONAL_OP);
    }

    private Expression parseAdditiveExpression() {
        return parseBinaryExpression(this::parseMultiplicativeExpression, TokenType.ADDITIVE_OP);
    }

    private Expression parseMultiplicativeExpression() {
        return parseBinaryExpression(this::parseUnaryExpression, TokenType.MULTIPLICATIVE_OP);
    }

    /**
     * One left-associative precedence level: operands come from {@code operand}, operators are
     * tokens of {@code operatorType}.
     */
    private Expression parseBinaryExpression(Supplier<Expression> operand, TokenType operatorType) {
        Expression left = operand.get();
        while (check(operatorType)) {
            Token opToken = consume(operatorType);
            BinaryOperator op = BinaryOperator.fromSymbol(opToken.value());
            if (op == BinaryOperator.INVALID) {
                throw new UnknownOperatorException(OperatorKind.BINARY, opToken.value());
            }
            Expression right = operand.get();
            left = new BinaryExpr(op, left, right);
        }
        return left;
    }

    private Expression parseLogicalExpression(Supplier<Expression> operand, TokenType operatorType) {
        Expression left = operand.get();
        while (check(operatorType)) {
            Token opToken = consume(operatorType);
            LogicalOperator op = LogicalOperator.fromSymbol(opToken.value());
            if (op == LogicalOperator.INVALID) {
                throw new UnknownOperatorException(OperatorKind.LOGICAL, opToken.value());
            }
            Expression right = operand.get();
            left = new LogicalExpr(op, left, right);
        }
        return left;
    }

    // UnaryExpr
    //   : LeftHandSideExpr
    //   | ADDITIVE_OP UnaryExpr
    //   | NOT_OP UnaryExpr
    //   ;
    private Expression parseUnaryExpression() {
        if (!check(TokenType.ADDITIVE_OP) && !check(TokenType.NOT_OP)) {
            return parseLeftHandSideExpression();
        }

        Token opToken = consume(lookahead.type());
        UnaryOperator op = UnaryOperator.fromSymbol(opToken.value());
        if (op == UnaryOperator.INVALID) {
            throw new UnknownOperatorException(OperatorKind.UNARY, opToken.value());
        }
        return new UnaryExpr(op, parseUnaryExpression());
    }

    // LeftHandSideExpr
    //   : MemberExpr
    //   | CallExpr
    //   | SuperCall CallArgs
    //   ;
    private Expression parseLeftHandSideExpression() {
        if (match(TokenType.SUPER)) {
            return parseCallExpression(new SuperCall());
        }

        Expression member = parseMemberExpression();
        // The result of `new` is not called again
        if (check(TokenType.OPEN_PAREN) && !(member instanceof NewExpr)) {
            return parseCallExpression(member);
        }
        return member;
    }

    // CallExpr
    //   : Callee CallArgs
    //   ;
    //
    // Callee
    //   : MemberExpr
    //   | CallExpr
    //   ;
    private Expression parseCallExpression(Expression callee) {
        Expression call = new CallExpr(callee, parseCallArguments());
        while (check(TokenType.OPEN_PAREN)) {
            call = new CallExpr(call, parseCallArguments());
        }
        return call;
    }

    // CallArgs
    //   : '(' OptArgList ')'
    //   ;
    //
    // ArgList
    //   : AssignExpr
    //   | ArgList ',' AssignExpr
    //   ;
    private List<Expression> parseCallArguments() {
        consume(TokenType.OPEN_PAREN);
        List<Expression> args = new ArrayList<>();
        if (!check(TokenType.CLOSE_PAREN)) {
            do {
                args.add(parseAssignmentExpression());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.CLOSE_PAREN);
        return args;
    }

    // MemberExpr
    //   : PrimaryExpr
    //   | MemberExpr '.' Identifier
    //   | MemberExpr '[' SeqExpr ']'
    //   ;
    private Expression parseMemberExpression() {
        Expression obj = parsePrimaryExpression();
        while (true) {
            if (match(TokenType.DOT)) {
                obj = new MemberExpr(false, obj, parseIdentifier());
            } else if (match(TokenType.OPEN_SQUARE)) {
                Expression prop = parseSequenceExpression();
                consume(TokenType.CLOSE_SQUARE);
                obj = new MemberExpr(true, obj, prop);
            } else {
                return obj;
            }
        }
    }

    // PrimaryExpr
    //   : Literal
    //   | '(' SeqExpr ')'
    //   | Identifier
    //   | 'this'
    //   | NewExpr
    //   ;
    private Expression parsePrimaryExpression() {
        switch (lookahead.type()) {
            case OPEN_PAREN: {
                consume(TokenType.OPEN_PAREN);
                Expression expr = parseSequenceExpression();
                consume(TokenType.CLOSE_PAREN);
                return expr;
            }
            case IDENTIFIER:
                return parseIdentifier();
            case THIS:
                consume(TokenType.THIS);
                return new ThisExpr();
            case NEW:
                return parseNewExpression();
            case EOF:
                throw new UnexpectedEndOfInputException(null);
            default:
                return parseLiteral();
        }
    }

    // NewExpr
    //   : 'new' MemberExpr CallArgs
    //   ;
    private NewExpr parseNewExpression() {
        consume(TokenType.NEW);
        Expression callee = parseMemberExpression();
        return new NewExpr(callee, parseCallArguments());
    }

    // Literal
    //   : NUMBER
    //   | STRING
    //   | 'true'
    //   | 'false'
    //   | 'null'
    //   ;
    private Expression parseLiteral() {
        switch (lookahead.type()) {
            case NUMBER:
                return parseNumericLiteral();
            case STRING: {
                String text = consume(TokenType.STRING).value();
                // Strip the quotes; there are no escape sequences
                return new StringLit(text.substring(1, text.length() - 1));
            }
            case TRUE:
                consume(TokenType.TRUE);
                return new BoolLit(true);
            case FALSE:
                consume(TokenType.FALSE);
                return new BoolLit(false);
            case NULL:
                consume(TokenType.NULL);
                return new NullLit();
            default:
                throw new UnknownLiteralException(lookahead);
        }
    }

    private NumericLit parseNumericLiteral() {
        String text = consume(TokenType.NUMBER).value();
        try {
            return new NumericLit(Long.parseLong(text));
        } catch (NumberFormatException e) {
            throw new InvalidNumberException(text, e);
        }
    }

    private Identifier parseIdentifier() {
        return new Identifier(consume(TokenType.IDENTIFIER).value());
    }

    // Helper methods

    private boolean check(TokenType type) {
        return lookahead.type() == type;
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            consume(type);
            return true;
        }
        return false;
    }

    /**
     * Consumes the lookahead if it has the given kind and fetches the next token.
     */
    private Token consume(TokenType type) {
        Token token = lookahead;
        if (token.type() == TokenType.EOF) {
            throw new UnexpectedEndOfInputException(type);
        }
        if (token.type() != type) {
            throw new UnexpectedTokenException(token, type);
        }
        lookahead = tokens.nextToken();
        return token;
    }
}

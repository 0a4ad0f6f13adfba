package com.scratchparser.ast;

public sealed interface Statement extends Node permits
    ExprStmt,
    BlockStmt,
    EmptyStmt,
    VarStmt,
    IfStmt,
    WhileStmt,
    DoWhileStmt,
    ForStmt,
    FuncDecl,
    ReturnStmt,
    ClassDecl {
}

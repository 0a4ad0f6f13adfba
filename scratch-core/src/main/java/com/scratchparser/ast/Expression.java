package com.scratchparser.ast;

public sealed interface Expression extends Node permits
    NumericLit,
    StringLit,
    BoolLit,
    NullLit,
    Identifier,
    ThisExpr,
    SuperCall,
    BinaryExpr,
    LogicalExpr,
    UnaryExpr,
    AssignExpr,
    SeqExpr,
    MemberExpr,
    CallExpr,
    NewExpr {
}

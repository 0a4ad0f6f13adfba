package com.scratchparser.jackson;

import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Writes the simple record name of each node (Program, BinaryExpr, ...) as its "type"
 * property, ahead of the node's own fields.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
abstract class NodeMixin {
}

package dev.typegen.core.model;

public enum PrimitiveKind {
  BOOLEAN, INTEGER, NUMBER, STRING
}

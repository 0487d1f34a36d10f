package de.upb.sse.jsweep.model;

public enum SymbolModifier { PUBLIC, PROTECTED, PRIVATE, STATIC, FINAL, ABSTRACT, DEFAULT }

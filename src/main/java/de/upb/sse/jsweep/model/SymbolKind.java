package de.upb.sse.jsweep.model;

public enum SymbolKind { METHOD, FIELD, IMPORT, CLASS }

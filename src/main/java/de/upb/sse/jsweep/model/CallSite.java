package de.upb.sse.jsweep.model;

import lombok.Value;

import java.nio.file.Path;

/**
 * A call expression inside a method body. {@code target} is the resolved project method, or null
 * when the call could not be resolved or targets code outside the project.
 */
@Value
public class CallSite {
    SymbolId caller;
    Path file;
    int line;
    int column;
    String methodName;
    int argumentCount;
    SymbolId target;

    public boolean isResolved() {
        return target != null;
    }
}

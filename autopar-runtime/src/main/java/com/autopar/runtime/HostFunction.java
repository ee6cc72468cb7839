package com.autopar.runtime;

import com.autopar.core.tree.SourcePos;

import java.util.List;

/** A function implemented by the runtime rather than by the interpreted program. */
@FunctionalInterface
public interface HostFunction {

    Object call(List<Object> args, ExecutionContext context, SourcePos pos);
}

/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.agentic.json;

import java.util.function.Supplier;

/**
 * Strategy interface for resolving a {@link AgenticJsonMapper}. Implementations are
 * discovered through {@link java.util.ServiceLoader}.
 */
public interface AgenticJsonMapperSupplier extends Supplier<AgenticJsonMapper> {

}

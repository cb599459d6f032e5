package io.spelunk.syntax.api;

/**
 * Semantic information resolved for a node by the compiler service.
 *
 * @param name symbol name
 * @param kind symbol kind as reported by the provider (e.g. {@code Method}, {@code Field})
 * @param returnType return or value type, or null if not applicable
 * @param containingType fully qualified containing type, or null
 */
public record SymbolInfo(String name, String kind, String returnType, String containingType) {}

package com.exprtree.json;

/**
 * Provider interface for dumping expression trees as JSON.
 * Implementations are discovered via Java's ServiceLoader mechanism.
 *
 * <p>To use a provider, add the implementation JAR (e.g., exprtree-jackson)
 * to your classpath. The provider will be automatically discovered.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * ExprJsonProvider provider = ExprJsonProvider.getProvider();
 * String json = provider.getSerializer().serialize(expr);
 * }</pre>
 *
 * <p>The dump is one-way. Nodes can only be built through an
 * {@link com.exprtree.ast.AstContext}, so there is no deserializer.</p>
 */
public interface ExprJsonProvider {

    /**
     * Returns the serializer for converting expression trees to JSON.
     *
     * @return the expression JSON serializer
     */
    ExprJsonSerializer getSerializer();

    /**
     * Returns the name of this provider (e.g., "Jackson").
     *
     * @return the provider name
     */
    String getName();

    /**
     * Gets the first available ExprJsonProvider via ServiceLoader.
     *
     * @return the provider
     * @throws IllegalStateException if no provider is found on the classpath
     */
    static ExprJsonProvider getProvider() {
        return ExprJsonProviders.first();
    }

    /**
     * Gets an ExprJsonProvider by name via ServiceLoader.
     *
     * @param name the provider name (e.g., "Jackson"), matched ignoring case
     * @return the provider
     * @throws IllegalStateException if no matching provider is found
     */
    static ExprJsonProvider getProvider(String name) {
        return ExprJsonProviders.named(name);
    }

    /**
     * Checks if any provider is available on the classpath.
     *
     * @return true if at least one provider is available
     */
    static boolean isProviderAvailable() {
        return ExprJsonProviders.any();
    }
}

package com.exprtree.json;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * ServiceLoader lookups behind the static methods of {@link ExprJsonProvider}.
 */
final class ExprJsonProviders {

    private static final Logger LOG = LoggerFactory.getLogger(ExprJsonProviders.class);

    private ExprJsonProviders() {
    }

    static ExprJsonProvider first() {
        ServiceLoader<ExprJsonProvider> loader = ServiceLoader.load(ExprJsonProvider.class);
        Iterator<ExprJsonProvider> iterator = loader.iterator();
        if (iterator.hasNext()) {
            ExprJsonProvider provider = iterator.next();
            LOG.debug("Using ExprJsonProvider '{}' ({})", provider.getName(), provider.getClass().getName());
            return provider;
        }
        throw new IllegalStateException(
            "No ExprJsonProvider found on the classpath. " +
            "Add exprtree-jackson (or another provider) to your dependencies."
        );
    }

    static ExprJsonProvider named(String name) {
        ServiceLoader<ExprJsonProvider> loader = ServiceLoader.load(ExprJsonProvider.class);
        for (ExprJsonProvider provider : loader) {
            if (provider.getName().equalsIgnoreCase(name)) {
                LOG.debug("Using ExprJsonProvider '{}' ({})", provider.getName(), provider.getClass().getName());
                return provider;
            }
            LOG.debug("Skipping ExprJsonProvider '{}', looking for '{}'", provider.getName(), name);
        }
        throw new IllegalStateException(
            "No ExprJsonProvider found with name '" + name + "'. " +
            "Ensure the appropriate provider JAR is on the classpath."
        );
    }

    static boolean any() {
        ServiceLoader<ExprJsonProvider> loader = ServiceLoader.load(ExprJsonProvider.class);
        return loader.iterator().hasNext();
    }
}

package com.arrowc.json;

import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Entry point for JSON support. A provider bundles a serializer and a deserializer for
 * tokens, source trees and target trees.
 *
 * <p>Providers register themselves in {@code META-INF/services/com.arrowc.json.AstJsonProvider}
 * and are found with {@link ServiceLoader}, so putting arrowc-jackson on the classpath is enough:</p>
 * <pre>{@code
 * AstJsonProvider json = AstJsonProvider.getProvider();
 * String text = json.getSerializer().serialize(target);
 * TargetProgram back = json.getDeserializer().deserializeTargetProgram(text);
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    AstJsonDeserializer getDeserializer();

    /**
     * Short name used by {@link #getProvider(String)}, matched ignoring case.
     */
    String getName();

    /**
     * @throws IllegalStateException if no provider is registered
     */
    static AstJsonProvider getProvider() {
        return findProvider(null).orElseThrow(() -> new IllegalStateException(
            "No AstJsonProvider registered; add arrowc-jackson to the classpath"));
    }

    /**
     * @throws IllegalStateException if no registered provider has this name
     */
    static AstJsonProvider getProvider(String name) {
        return findProvider(name).orElseThrow(() -> new IllegalStateException(
            "No AstJsonProvider named '" + name + "' is registered"));
    }

    static boolean isProviderAvailable() {
        return findProvider(null).isPresent();
    }

    private static Optional<AstJsonProvider> findProvider(String name) {
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            if (name == null || provider.getName().equalsIgnoreCase(name)) {
                return Optional.of(provider);
            }
        }
        return Optional.empty();
    }
}

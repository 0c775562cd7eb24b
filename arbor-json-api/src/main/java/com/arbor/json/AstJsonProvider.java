package com.arbor.json;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * Entry point to the JSON form of trees. Implementations are found with {@link ServiceLoader},
 * so putting an implementation jar such as arbor-jackson on the classpath is enough.
 *
 * <pre>{@code
 * AstJsonProvider provider = AstJsonProvider.getProvider();
 * String json = provider.getSerializer().serialize(program);
 * Program copy = provider.getDeserializer().deserializeProgram(json);
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    AstJsonDeserializer getDeserializer();

    /**
     * Short name used to select this provider, e.g. "Jackson".
     */
    String getName();

    /**
     * Returns the first provider on the classpath.
     *
     * @throws IllegalStateException if there is none
     */
    static AstJsonProvider getProvider() {
        Iterator<AstJsonProvider> iterator = ServiceLoader.load(AstJsonProvider.class).iterator();
        if (iterator.hasNext()) {
            AstJsonProvider provider = iterator.next();
            log().debug("Using AstJsonProvider '{}' ({})", provider.getName(), provider.getClass().getName());
            return provider;
        }
        throw new IllegalStateException(
            "No AstJsonProvider found on the classpath. " +
            "Add arbor-jackson (or another provider) to your dependencies."
        );
    }

    /**
     * Returns the provider whose name equals {@code name}, ignoring case.
     *
     * @throws IllegalStateException if there is none
     */
    static AstJsonProvider getProvider(String name) {
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            if (provider.getName().equalsIgnoreCase(name)) {
                log().debug("Using AstJsonProvider '{}' ({})", provider.getName(), provider.getClass().getName());
                return provider;
            }
        }
        throw new IllegalStateException(
            "No AstJsonProvider found with name '" + name + "'. " +
            "Ensure the appropriate provider jar is on the classpath."
        );
    }

    static boolean isProviderAvailable() {
        return ServiceLoader.load(AstJsonProvider.class).iterator().hasNext();
    }

    private static Logger log() {
        return LoggerFactory.getLogger(AstJsonProvider.class);
    }
}

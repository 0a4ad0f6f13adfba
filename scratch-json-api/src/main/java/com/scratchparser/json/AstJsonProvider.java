package com.scratchparser.json;

import com.scratchparser.ast.Node;

import java.util.ServiceLoader;

/**
 * A JSON binding for syntax trees, found at runtime through {@link ServiceLoader}.
 *
 * <p>The binding jar registers its implementation under
 * {@code META-INF/services/com.scratchparser.json.AstJsonProvider}; scratch-jackson ships one.</p>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    /**
     * Short name of the binding, for diagnostics.
     */
    String getName();

    /**
     * Renders a tree in one of the two output layouts.
     *
     * @param pretty two-space indented when true, single line otherwise
     */
    default String render(Node node, boolean pretty) throws AstJsonException {
        AstJsonSerializer serializer = getSerializer();
        return pretty ? serializer.serializePretty(node) : serializer.serialize(node);
    }

    /**
     * Loads the first binding registered on the classpath.
     *
     * @throws IllegalStateException if no binding is registered
     */
    static AstJsonProvider getProvider() {
        return ServiceLoader.load(AstJsonProvider.class)
            .findFirst()
            .orElseThrow(() -> new IllegalStateException(
                "No syntax tree JSON binding on the classpath; add scratch-jackson"));
    }
}

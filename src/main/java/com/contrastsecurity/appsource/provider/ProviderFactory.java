package com.contrastsecurity.appsource.provider;

import com.contrastsecurity.appsource.config.ConfigurationException;
import com.contrastsecurity.appsource.config.ProviderConfig;
import com.contrastsecurity.appsource.constants.ProviderKind;

/**
 * Creates the provider for a configuration entry.
 */
public class ProviderFactory {
    private final ProviderContext context;

    public ProviderFactory(ProviderContext context) {
        this.context = context;
    }

    /**
     * @throws ConfigurationException for an unsupported kind, or options missing for the kind
     * @throws ProviderException if the provider cannot load its upstream data
     */
    public AppProvider create(ProviderConfig config) throws ConfigurationException, ProviderException {
        ProviderKind kind = kindOf(config);
        config.validatePatterns();
        switch (kind) {
            case CATALOG:
                return CatalogMirrorProvider.open(config.getSource() != null ? config.getSource() : config.getUrl(),
                        context.getDocumentFetcher());
            case GITHUB:
                return ReleaseFeedProvider.open(config, context);
            case RELEASES:
                return CuratedFeedProvider.open(config, context);
            default:
                throw new ConfigurationException("Unsupported provider kind: " + config.getKind());
        }
    }

    /**
     * @throws ConfigurationException if the kind is not one of the supported values
     */
    public static ProviderKind kindOf(ProviderConfig config) throws ConfigurationException {
        ProviderKind kind = ProviderKind.fromString(config.getKind());
        if (kind == null) {
            throw new ConfigurationException("Unsupported provider kind: " + config.getKind());
        }
        return kind;
    }

    public ProviderContext getContext() {
        return context;
    }
}

package ai.stubdoc.translator.translate;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Provides catalog instances based on the desired translation mode.
 *
 * <p>The on-disk catalog is only loaded the first time {@link TranslationMode#CATALOG} is selected.
 */
public class CatalogFactory {

    private final Supplier<MessageCatalog> catalogLoader;
    private final MessageCatalog dryRunCatalog;
    private final MessageCatalog mockCatalog;
    private MessageCatalog loadedCatalog;

    public CatalogFactory(Supplier<MessageCatalog> catalogLoader) {
        this(catalogLoader, new PassThroughCatalog(), new MockCatalog());
    }

    public CatalogFactory(Supplier<MessageCatalog> catalogLoader,
                          MessageCatalog dryRunCatalog,
                          MessageCatalog mockCatalog) {
        this.catalogLoader = Objects.requireNonNull(catalogLoader, "catalogLoader");
        this.dryRunCatalog = Objects.requireNonNull(dryRunCatalog, "dryRunCatalog");
        this.mockCatalog = Objects.requireNonNull(mockCatalog, "mockCatalog");
    }

    public MessageCatalog select(TranslationMode mode) {
        return switch (mode) {
            case CATALOG -> loadedCatalog();
            case DRY_RUN -> dryRunCatalog;
            case MOCK -> mockCatalog;
        };
    }

    private synchronized MessageCatalog loadedCatalog() {
        if (loadedCatalog == null) {
            loadedCatalog = Objects.requireNonNull(catalogLoader.get(), "loaded catalog");
        }
        return loadedCatalog;
    }
}

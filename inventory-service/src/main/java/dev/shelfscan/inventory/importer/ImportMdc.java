package dev.shelfscan.inventory.importer;

import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.MDC;
import org.springframework.util.StringUtils;

/**
 * Mapped diagnostic context entries shared by log lines emitted during one batch operation.
 */
final class ImportMdc {

    private static final String KEY_BATCH_ID = "inventory.batchId";
    private static final String KEY_SELLER_ID = "inventory.sellerId";
    private static final String KEY_OPERATION = "inventory.operation";

    private ImportMdc() {
        // Utility class
    }

    static Context open(String operation, String batchId) {
        return new Context(operation, batchId);
    }

    static void attachSeller(String sellerId) {
        putIfHasText(KEY_SELLER_ID, sellerId);
    }

    /**
     * Runs {@code task} with the given context map on the current thread, restoring the previous map after.
     */
    static <T> T callWith(Map<String, String> context, Supplier<T> task) {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        if (context == null) {
            MDC.clear();
        } else {
            MDC.setContextMap(context);
        }
        try {
            return task.get();
        } finally {
            restore(previous);
        }
    }

    private static void putIfHasText(String key, String value) {
        if (StringUtils.hasText(value)) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    private static void restore(Map<String, String> previous) {
        if (previous == null) {
            MDC.clear();
        } else {
            MDC.setContextMap(previous);
        }
    }

    static final class Context implements AutoCloseable {

        private final Map<String, String> previous;

        private Context(String operation, String batchId) {
            this.previous = MDC.getCopyOfContextMap();
            putIfHasText(KEY_OPERATION, operation);
            putIfHasText(KEY_BATCH_ID, batchId);
        }

        @Override
        public void close() {
            restore(previous);
        }
    }
}

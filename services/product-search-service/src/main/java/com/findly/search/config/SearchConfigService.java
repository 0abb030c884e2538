package com.findly.search.config;

import jakarta.annotation.PostConstruct;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Holds the current configuration snapshot. Readers take the reference once per request; a reload
 * swaps in a complete new snapshot or leaves the old one in place.
 */
@Service
public class SearchConfigService {
    private static final Logger log = LoggerFactory.getLogger(SearchConfigService.class);

    private final SearchConfigLoader loader;
    private final SearchConfigProperties properties;
    private final AtomicReference<SearchConfigSnapshot> current = new AtomicReference<>(SearchConfigSnapshot.defaults());

    public SearchConfigService(SearchConfigLoader loader, SearchConfigProperties properties) {
        this.loader = loader;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        try {
            SearchConfigSnapshot loaded = loader.load(properties.getLocation());
            current.set(loaded);
            log.info(
                "search config loaded version={} categories={} strategies={}",
                loaded.getVersion(),
                loaded.getPriceBands().size(),
                loaded.getStrategies().size()
            );
        } catch (SearchConfigException ex) {
            log.warn("search config load failed, using built-in defaults: {}", ex.getMessage());
        }
    }

    @Scheduled(
        fixedDelayString = "${search.config.reload-interval-ms:300000}",
        initialDelayString = "${search.config.reload-interval-ms:300000}"
    )
    public void scheduledReload() {
        if (properties.isReloadEnabled()) {
            reload();
        }
    }

    /**
     * @return true when a new snapshot was installed
     */
    public boolean reload() {
        SearchConfigSnapshot previous = current.get();
        try {
            SearchConfigSnapshot loaded = loader.load(properties.getLocation());
            current.set(loaded);
            if (!loaded.getVersion().equals(previous.getVersion())) {
                log.info("search config reloaded version={} previous={}", loaded.getVersion(), previous.getVersion());
            }
            return true;
        } catch (SearchConfigException ex) {
            log.warn("search config reload failed, keeping version={}: {}", previous.getVersion(), ex.getMessage());
            return false;
        }
    }

    public SearchConfigSnapshot current() {
        return current.get();
    }
}

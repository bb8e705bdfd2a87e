package io.mersel.services.xbrl.infrastructure.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * XBRL motoru yapılandırma özellikleri.
 * <p>
 * {@code xbrl} prefix'i altındaki değerleri okur.
 * <ul>
 *   <li>{@code entity-scheme}: Üretilen bağlamlarda işletme tanımlayıcı şeması</li>
 *   <li>{@code reporting-periods}: Şablonlarda desteklenen raporlama dönemleri</li>
 *   <li>{@code currencies}: Şablonlarda desteklenen para birimleri</li>
 *   <li>{@code namespaces}: Standart bağlamalara eklenen önek → URI eşlemeleri</li>
 *   <li>{@code taxonomy-cache.max-size}: Önbellekteki en fazla taksonomi sayısı (pozitif olmalı)</li>
 *   <li>{@code taxonomy-cache.expire-after-access-minutes}: Erişimsiz kalma süresi (pozitif olmalı)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "xbrl")
public class XbrlProperties {

    private static final Logger log = LoggerFactory.getLogger(XbrlProperties.class);

    private static final List<String> DEFAULT_PERIODS = List.of("quarterly", "annual");
    private static final List<String> DEFAULT_CURRENCIES = List.of("USD", "EUR", "GBP", "INR");

    private String entityScheme = "http://www.sec.gov/CIK";
    private List<String> reportingPeriods = new ArrayList<>(DEFAULT_PERIODS);
    private List<String> currencies = new ArrayList<>(DEFAULT_CURRENCIES);
    private Map<String, String> namespaces = new LinkedHashMap<>();
    private final TaxonomyCache taxonomyCache = new TaxonomyCache();

    @PostConstruct
    void validate() {
        if (entityScheme == null || entityScheme.isBlank()) {
            log.warn("entity-scheme boş olamaz, varsayılan http://www.sec.gov/CIK kullanılıyor");
            entityScheme = "http://www.sec.gov/CIK";
        }
        if (reportingPeriods == null || reportingPeriods.isEmpty()) {
            log.warn("reporting-periods boş, varsayılan {} kullanılıyor", DEFAULT_PERIODS);
            reportingPeriods = new ArrayList<>(DEFAULT_PERIODS);
        }
        if (currencies == null || currencies.isEmpty()) {
            log.warn("currencies boş, varsayılan {} kullanılıyor", DEFAULT_CURRENCIES);
            currencies = new ArrayList<>(DEFAULT_CURRENCIES);
        }
        if (taxonomyCache.maxSize <= 0) {
            log.warn("taxonomy-cache.max-size pozitif olmalı (verilen: {}), varsayılan 64 kullanılıyor", taxonomyCache.maxSize);
            taxonomyCache.maxSize = 64;
        }
        if (taxonomyCache.expireAfterAccessMinutes <= 0) {
            log.warn("taxonomy-cache.expire-after-access-minutes pozitif olmalı (verilen: {}), varsayılan 60 kullanılıyor",
                    taxonomyCache.expireAfterAccessMinutes);
            taxonomyCache.expireAfterAccessMinutes = 60;
        }
    }

    public String getEntityScheme() {
        return entityScheme;
    }

    public void setEntityScheme(String entityScheme) {
        this.entityScheme = entityScheme;
    }

    public List<String> getReportingPeriods() {
        return reportingPeriods;
    }

    public void setReportingPeriods(List<String> reportingPeriods) {
        this.reportingPeriods = reportingPeriods;
    }

    public List<String> getCurrencies() {
        return currencies;
    }

    public void setCurrencies(List<String> currencies) {
        this.currencies = currencies;
    }

    public Map<String, String> getNamespaces() {
        return namespaces;
    }

    public void setNamespaces(Map<String, String> namespaces) {
        this.namespaces = namespaces;
    }

    public TaxonomyCache getTaxonomyCache() {
        return taxonomyCache;
    }

    public static class TaxonomyCache {

        private int maxSize = 64;
        private int expireAfterAccessMinutes = 60;

        public int getMaxSize() {
            return maxSize;
        }

        public void setMaxSize(int maxSize) {
            this.maxSize = maxSize;
        }

        public int getExpireAfterAccessMinutes() {
            return expireAfterAccessMinutes;
        }

        public void setExpireAfterAccessMinutes(int expireAfterAccessMinutes) {
            this.expireAfterAccessMinutes = expireAfterAccessMinutes;
        }
    }
}

package com.dataplatform.acquisition.config;

import com.dataplatform.common.conflict.ResolutionStrategy;
import com.dataplatform.common.model.AnalysisType;
import com.dataplatform.common.model.DataType;
import com.dataplatform.common.model.Granularity;
import com.dataplatform.common.model.ProviderCategory;
import com.dataplatform.common.model.ProviderScope;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything under {@code acquisition.*}: the provider catalog, cache tuning, per-data-type
 * TTLs and reconciliation rules, executor defaults and the warm-up list.
 *
 * <p>A data type missing from the TTL or reconciliation tables falls back to the
 * {@code default-*} values.
 */
@Data
@ConfigurationProperties(prefix = "acquisition")
public class AcquisitionProperties {

    private List<Provider> providers = new ArrayList<>();
    private Cache cache = new Cache();
    private Reconciliation reconciliation = new Reconciliation();
    private Executor executor = new Executor();
    private Warmup warmup = new Warmup();

    @Data
    public static class Provider {
        private String id;
        private String displayName;
        /** Adapter implementation key, e.g. {@code alpha-vantage} or {@code fred}. */
        private String adapter;
        private boolean enabled = true;
        private String baseUrl;
        private String apiKey;
        private ProviderCategory category = ProviderCategory.COMMERCIAL;
        private ProviderScope scope = ProviderScope.INDIVIDUAL_ENTITY;
        private Set<DataType> dataTypes = EnumSet.noneOf(DataType.class);
        private RateLimit rateLimit = new RateLimit();
        private double reliability = 0.9;
        private double costPerRequest;
        private double monthlyBudget;
        private Duration timeout = Duration.ofSeconds(5);
        private Activation activation = new Activation();
        private Priority priority = new Priority();
    }

    @Data
    public static class RateLimit {
        private int requests = 60;
        private Duration window = Duration.ofMinutes(1);
        private int burst;
        private Duration burstWindow = Duration.ofSeconds(10);
        private int dailyCap;
        /** ISO local time, e.g. {@code 00:00}. */
        private String dailyResetTime = "00:00";
        private String zone = "UTC";
    }

    /** Competence boundaries compiled into a typed activation predicate. */
    @Data
    public static class Activation {
        private Integer minEntities;
        private Integer maxEntities;
        private boolean requiresNoEntities;
        private boolean requiresSector;
        private Set<AnalysisType> analysisTypes = EnumSet.noneOf(AnalysisType.class);
        /** {@code true}: real-time only; {@code false}: never real-time; unset: either. */
        private Boolean realTime;
        private Granularity finestGranularity;
    }

    @Data
    public static class Priority {
        private int base;
        private Set<AnalysisType> specialties = EnumSet.noneOf(AnalysisType.class);
        private int analysisTypeBoost;
        private int realTimeBoost;
        private int sectorBoost;
    }

    @Data
    public static class Cache {
        private long fastTierMaxSize = 10_000;
        private Duration defaultTtl = Duration.ofMinutes(5);
        private Map<DataType, Duration> ttl = new EnumMap<>(DataType.class);
        private double refreshThreshold = 0.7;
        private Duration stalenessCeiling = Duration.ofDays(7);
        private int compressionThresholdBytes = 4096;
        private Duration sweepInterval = Duration.ofMinutes(10);
        private Durable durable = new Durable();
        private Anomaly anomaly = new Anomaly();
        private Refresh refresh = new Refresh();

        public Duration ttlFor(DataType dataType) {
            return ttl.getOrDefault(dataType, defaultTtl);
        }
    }

    @Data
    public static class Durable {
        /** {@code memory} (single node) or {@code redis} (shared across instances). */
        private String type = "memory";
        private String keyPrefix = "acq:cache:";
    }

    @Data
    public static class Anomaly {
        private int historySize = 20;
        private int minHistory = 5;
        private double stdDevs = 3.0;
        private double downgradeFactor = 0.5;
    }

    @Data
    public static class Refresh {
        private int workers = 4;
        private int queueCapacity = 256;
        private Duration taskTimeout = Duration.ofSeconds(30);
        private Duration shutdownGrace = Duration.ofSeconds(10);
    }

    @Data
    public static class Reconciliation {
        private ResolutionStrategy defaultStrategy = ResolutionStrategy.USE_HIGHEST_QUALITY;
        private double defaultTolerancePercent = 2.0;
        private Map<DataType, Rule> rules = new EnumMap<>(DataType.class);
    }

    @Data
    public static class Rule {
        private ResolutionStrategy strategy;
        private Double tolerancePercent;
    }

    @Data
    public static class Executor {
        /** Applied when a request carries no deadline of its own; unset means none. */
        private Duration defaultDeadline;
    }

    @Data
    public static class Warmup {
        private boolean enabled;
        private Duration initialDelay = Duration.ofSeconds(30);
        private Duration interval = Duration.ofMinutes(5);
        private List<WarmupRequest> requests = new ArrayList<>();
    }

    @Data
    public static class WarmupRequest {
        private DataType dataType;
        private List<String> entityKeys = new ArrayList<>();
        private String sector;
    }
}

package com.tazifor.elevations.config;

import com.tazifor.elevations.geo.spi.CellCodec;
import com.tazifor.elevations.geo.spi.H3CellCodec;
import com.tazifor.elevations.model.RequestShape;
import com.tazifor.elevations.service.PopulationDedupCache;
import com.tazifor.elevations.service.ResolutionLimits;
import com.tazifor.elevations.service.ResponseAssembler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Request limits, the H3 codec and the population dedup cache.
 *
 * The dedup cache is created once per process and shared by every request.
 */
@Slf4j
@Configuration
public class ElevationsConfig {

    @Value("${elevations.min-resolution:8}")
    private int minResolution;

    @Value("${elevations.max-resolution:12}")
    private int maxResolution;

    @Value("${elevations.cell-limit:15}")
    private int cellLimit;

    @Value("${elevations.polygon-cell-limit-multiplier:100}")
    private int polygonCellLimitMultiplier;

    @Value("${elevations.population.ttl-seconds:240}")
    private long populationTtlSeconds;

    @Value("${elevations.population.cache-max-entries:10000}")
    private int cacheMaxEntries;

    @Value("${elevations.population.estimated-wait-seconds:240}")
    private int estimatedWaitSeconds;

    @Value("${elevations.population.wait-seconds-per-cell:0}")
    private double waitSecondsPerCell;

    @Bean
    public ResolutionLimits resolutionLimits() {
        ResolutionLimits limits = new ResolutionLimits(minResolution, maxResolution, cellLimit, polygonCellLimitMultiplier);
        log.info("Resolution {}..{}, {} cells per request ({} for polygons)",
            minResolution, maxResolution, cellLimit, limits.cellLimitFor(RequestShape.Kind.POLYGON));
        return limits;
    }

    @Bean
    public CellCodec cellCodec() {
        return new H3CellCodec();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PopulationDedupCache populationDedupCache(Clock clock) {
        return new PopulationDedupCache(clock, Duration.ofSeconds(populationTtlSeconds), cacheMaxEntries);
    }

    @Bean
    public ResponseAssembler responseAssembler() {
        return new ResponseAssembler(estimatedWaitSeconds, waitSecondsPerCell);
    }
}

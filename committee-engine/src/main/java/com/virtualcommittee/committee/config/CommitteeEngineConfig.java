package com.virtualcommittee.committee.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.virtualcommittee.common.config.CommitteeConfig;
import com.virtualcommittee.common.config.ScreeningCriteria;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.json.ProblemDetailJacksonMixin;

@Configuration
public class CommitteeEngineConfig {

    @Value("${committee.capital:500.0}")
    private double capital;

    @Value("${committee.leverage:5}")
    private int leverage;

    @Value("${committee.screening.min-price:2.0}")
    private double minPrice;

    @Value("${committee.screening.max-price:500.0}")
    private double maxPrice;

    @Value("${committee.screening.min-market-cap:100000000}")
    private double minMarketCap;

    @Value("${committee.screening.max-market-cap:100000000000}")
    private double maxMarketCap;

    @Value("${committee.screening.min-beta:1.5}")
    private double minBeta;

    @Value("${committee.screening.min-volume.small-cap:1000000}")
    private double minVolumeSmallCap;

    @Value("${committee.screening.min-volume.mid-cap:750000}")
    private double minVolumeMidCap;

    @Value("${committee.screening.min-volume.large-cap:500000}")
    private double minVolumeLargeCap;

    /** Account defaults used when a request does not carry its own capital/leverage. */
    @Bean
    public CommitteeConfig committeeConfig() {
        return CommitteeConfig.of(capital, leverage);
    }

    @Bean
    public ScreeningCriteria screeningCriteria() {
        return new ScreeningCriteria(minPrice, maxPrice, minMarketCap, maxMarketCap, minBeta,
                                     minVolumeSmallCap, minVolumeMidCap, minVolumeLargeCap);
    }

    /** Problem responses keep {@code code}/{@code component} as top-level members. */
    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.addMixIn(ProblemDetail.class, ProblemDetailJacksonMixin.class);
        return mapper;
    }
}

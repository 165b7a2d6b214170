package com.jcmt.hetitc.catalog;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

/** Builds the receiver catalog once, at startup. */
@Slf4j
@Configuration
public class CatalogConfig {

    @Bean
    public StaticReceiverCatalog receiverCatalog(
            @Value("${itc.catalog.receivers:receiver_info.json}") String receivers,
            @Value("${itc.catalog.tau-dir:tau}") String tauDir) {
        log.info("Loading receiver catalog from classpath:{} (opacity tables in classpath:{}/)", receivers, tauDir);
        try {
            return new ReceiverCatalogLoader(receivers, tauDir).load();
        } catch (IOException e) {
            throw new IllegalStateException("Cannot load receiver catalog: " + e.getMessage(), e);
        }
    }
}

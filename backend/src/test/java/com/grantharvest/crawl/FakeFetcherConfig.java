package com.grantharvest.crawl;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

@TestConfiguration
public class FakeFetcherConfig {

    @Bean
    @Primary
    FakeListingPageFetcher fakeListingPageFetcher() {
        return new FakeListingPageFetcher();
    }
}

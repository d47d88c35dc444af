package com.grantharvest.crawl.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.grantharvest.config.HarvesterProperties;
import com.grantharvest.crawl.model.CrawlRunSummary;
import com.grantharvest.crawl.model.StoredGrant;
import com.grantharvest.crawl.persistence.GrantJdbcRepository;
import com.grantharvest.crawl.persistence.StorageFaultException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * One-shot harvest: crawl, dump the store, then shut the context down (which closes the grant
 * store) whether or not the crawl succeeded.
 */
@Component
public class HarvestCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(HarvestCliRunner.class);
    static final int EXIT_STORAGE_FAULT = 1;
    static final int EXIT_DUMP_FAILED = 2;
    static final int EXIT_UNEXPECTED = 3;

    private final HarvesterProperties properties;
    private final GrantCrawlService crawlService;
    private final GrantJdbcRepository grantRepository;
    private final GrantCsvExporter csvExporter;
    private final ObjectMapper objectMapper;
    private final ConfigurableApplicationContext applicationContext;

    public HarvestCliRunner(
        HarvesterProperties properties,
        GrantCrawlService crawlService,
        GrantJdbcRepository grantRepository,
        GrantCsvExporter csvExporter,
        ObjectMapper objectMapper,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.crawlService = crawlService;
        this.grantRepository = grantRepository;
        this.csvExporter = csvExporter;
        this.objectMapper = objectMapper;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        int exitCode = execute();
        if (properties.getCli().isExitAfterRun()) {
            System.exit(SpringApplication.exit(applicationContext, () -> exitCode));
        }
    }

    /**
     * Runs the harvest and maps its outcome to a process exit code. Failures are rethrown instead
     * when the runner is not going to exit.
     */
    int execute() {
        try {
            harvest();
            return 0;
        } catch (StorageFaultException e) {
            log.error("Harvest aborted by storage fault", e);
            return failWith(EXIT_STORAGE_FAULT, e);
        } catch (GrantDumpException e) {
            log.error("Harvest finished but the dump could not be written", e);
            return failWith(EXIT_DUMP_FAILED, e);
        } catch (RuntimeException e) {
            log.error("Harvest failed", e);
            return failWith(EXIT_UNEXPECTED, e);
        }
    }

    private int failWith(int exitCode, RuntimeException e) {
        if (!properties.getCli().isExitAfterRun()) {
            throw e;
        }
        return exitCode;
    }

    void harvest() {
        CrawlRunSummary summary = crawlService.run();
        log.info(
            "Harvest summary: fetched={}, inserted={}, duplicates={}, malformed={}, stopReason={}",
            summary.recordsFetched(),
            summary.inserted(),
            summary.duplicates(),
            summary.malformed(),
            summary.stopReason()
        );
        if (summary.fetchFailure() != null) {
            log.info(
                "Crawl stopped by fetch failure on page {} (status {})",
                summary.fetchFailure().pageIndex(),
                summary.fetchFailure().statusCode()
            );
        }

        if (!properties.getCli().isDumpAfterRun() && properties.getCli().getDumpCsv().isBlank()) {
            return;
        }
        List<StoredGrant> grants = grantRepository.findAll();
        if (properties.getCli().isDumpAfterRun()) {
            for (StoredGrant grant : grants) {
                log.info("{}", toJson(grant));
            }
        }
        String csvPath = properties.getCli().getDumpCsv();
        if (!csvPath.isBlank()) {
            try {
                int rows = csvExporter.export(grants, Path.of(csvPath));
                log.info("Wrote {} grants to {}", rows, csvPath);
            } catch (IOException e) {
                throw new GrantDumpException("failed to write grant dump to " + csvPath, e);
            }
        }
    }

    private String toJson(StoredGrant grant) {
        try {
            return objectMapper.writeValueAsString(grant);
        } catch (JsonProcessingException e) {
            return String.valueOf(grant);
        }
    }
}

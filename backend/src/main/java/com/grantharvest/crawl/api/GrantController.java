package com.grantharvest.crawl.api;

import com.grantharvest.crawl.model.CrawlRunRequest;
import com.grantharvest.crawl.model.CrawlRunSummary;
import com.grantharvest.crawl.model.StatusResponse;
import com.grantharvest.crawl.model.StoredGrant;
import com.grantharvest.crawl.persistence.GenreJdbcRepository;
import com.grantharvest.crawl.persistence.GrantJdbcRepository;
import com.grantharvest.crawl.service.GrantCrawlService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class GrantController {
    private final GrantCrawlService crawlService;
    private final GrantJdbcRepository grantRepository;
    private final GenreJdbcRepository genreRepository;

    public GrantController(
        GrantCrawlService crawlService,
        GrantJdbcRepository grantRepository,
        GenreJdbcRepository genreRepository
    ) {
        this.crawlService = crawlService;
        this.grantRepository = grantRepository;
        this.genreRepository = genreRepository;
    }

    @PostMapping("/crawl/run")
    public CrawlRunSummary runCrawl(@RequestBody(required = false) CrawlRunRequest request) {
        return crawlService.run(request == null ? CrawlRunRequest.defaults() : request);
    }

    @GetMapping("/grants")
    public List<StoredGrant> grants() {
        return grantRepository.findAll();
    }

    @GetMapping("/status")
    public StatusResponse status() {
        boolean reachable = grantRepository.isDbReachable();
        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put("grants", grantRepository.countGrants());
        counts.put("genres", genreRepository.countGenres());
        counts.put("grant_genre", genreRepository.countLinks());
        return new StatusResponse(reachable, counts);
    }
}

package com.grantharvest.crawl.http;

import com.grantharvest.config.HarvesterProperties;
import com.grantharvest.crawl.model.ListingPage;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;

@Service
public class JsoupListingPageFetcher implements ListingPageFetcher {
    private static final Logger log = LoggerFactory.getLogger(JsoupListingPageFetcher.class);

    private final HarvesterProperties properties;

    public JsoupListingPageFetcher(HarvesterProperties properties) {
        this.properties = properties;
    }

    @Override
    public ListingPage fetch(int pageIndex) {
        String url = pageUrl(pageIndex);
        try {
            Connection.Response response = Jsoup.connect(url)
                .userAgent(properties.getUserAgent())
                .timeout(properties.getRequestTimeoutSeconds() * 1000)
                .ignoreHttpErrors(true)
                .followRedirects(true)
                .execute();
            int status = response.statusCode();
            if (status != 200) {
                return ListingPage.failed(pageIndex, url, status, response.statusMessage());
            }
            return ListingPage.ok(pageIndex, url, response.parse());
        } catch (IOException e) {
            log.debug("Fetch of {} failed", url, e);
            return ListingPage.failed(pageIndex, url, 0, rootMessage(e));
        }
    }

    String pageUrl(int pageIndex) {
        return properties.getListingUrl() + pageIndex;
    }

    private String rootMessage(Throwable e) {
        Throwable current = e;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        String message = current.getMessage();
        return current.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }
}

package com.grantharvest.crawl.model;

import java.util.Map;

public record StatusResponse(boolean dbConnectivity, Map<String, Long> counts) {}

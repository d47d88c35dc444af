package com.grantharvest.crawl.model;

import java.util.Set;

public record StoredGrant(long id, Grant grant, Set<String> genres) {}

package com.ivyintel.tracker.scrape.model;

public record Source(String university, PageType pageType, String url) {}

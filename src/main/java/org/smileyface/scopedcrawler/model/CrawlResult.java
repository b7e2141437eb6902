package org.smileyface.scopedcrawler.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.smileyface.scopedcrawler.proxy.ProxyEntry;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One successfully fetched and admitted page, produced once per URL per session.
 *
 * @param url             normalized URL of the page
 * @param parentUrl       page the URL was discovered on, null for the seed
 * @param depth           link distance from the seed
 * @param score           relevance score the URL was queued with (0 for breadth-first and the seed)
 * @param content         rendered page text
 * @param links           normalized outbound links in document order, duplicates removed
 * @param contentType     response content type
 * @param fetchedViaProxy proxy used for the successful attempt, null for a direct connection
 * @param fetchedAt       completion time of the fetch
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CrawlResult(String url,
                          String parentUrl,
                          int depth,
                          double score,
                          String content,
                          List<String> links,
                          String contentType,
                          ProxyEntry fetchedViaProxy,
                          Instant fetchedAt) {

    public CrawlResult {
        Objects.requireNonNull(url, "url");
        content = content == null ? "" : content;
        links = links == null ? List.of() : List.copyOf(links);
    }
}

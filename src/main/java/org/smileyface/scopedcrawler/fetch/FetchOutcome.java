package org.smileyface.scopedcrawler.fetch;

import java.util.List;
import java.util.Map;

/**
 * A successfully fetched page, or a redirect the fetcher did not follow.
 *
 * @param statusCode       HTTP status, or 0 when not applicable
 * @param contentType      response content type header, may be null
 * @param rawLinks         absolute outbound links in document order
 * @param renderedText     visible text of the page
 * @param anchorContexts   link URL to anchor text / surrounding context
 * @param redirectLocation absolute redirect target, null unless this is a redirect
 */
public record FetchOutcome(int statusCode,
                           String contentType,
                           List<String> rawLinks,
                           String renderedText,
                           Map<String, String> anchorContexts,
                           String redirectLocation) {

    public FetchOutcome {
        rawLinks = rawLinks == null ? List.of() : List.copyOf(rawLinks);
        renderedText = renderedText == null ? "" : renderedText;
        anchorContexts = anchorContexts == null ? Map.of() : Map.copyOf(anchorContexts);
    }

    public FetchOutcome(int statusCode, String contentType, List<String> rawLinks, String renderedText,
                        Map<String, String> anchorContexts) {
        this(statusCode, contentType, rawLinks, renderedText, anchorContexts, null);
    }

    public static FetchOutcome redirect(int statusCode, String location) {
        return new FetchOutcome(statusCode, null, List.of(), "", Map.of(), location);
    }

    public boolean isRedirect() {
        return redirectLocation != null;
    }

    public String anchorContext(String link) {
        return anchorContexts.get(link);
    }
}

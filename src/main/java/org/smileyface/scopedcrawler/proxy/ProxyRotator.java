package org.smileyface.scopedcrawler.proxy;

import java.util.List;

/**
 * Hands out one proxy identity per outbound request. State is owned by the instance and lives
 * as long as one crawl session.
 */
public interface ProxyRotator {

    /**
     * @return the proxy to use for the next request attempt
     */
    ProxyEntry next();

    int size();

    List<ProxyEntry> entries();
}

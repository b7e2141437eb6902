package org.smileyface.scopedcrawler.filter;

import org.junit.jupiter.api.Test;
import org.smileyface.scopedcrawler.config.ConfigurationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FilterChainTest {

    private final FilterChain chain = FilterChain.from(
            FilterSpec.of("example.com", List.of("*/news/*"), "text/html"));

    @Test
    void admitsOnlyWhenEveryFilterAdmits() {
        assertThat(chain.admit("https://example.com/news/1", null)).isTrue();
        assertThat(chain.admit("https://example.com/about", null)).isFalse();
        assertThat(chain.admit("https://other.com/news/1", null)).isFalse();
        assertThat(chain.admit("https://example.com/news/1", "application/pdf")).isFalse();
        assertThat(chain.admit("https://example.com/news/1", "text/html; charset=UTF-8")).isTrue();
    }

    @Test
    void subdomainsAreInsideTheDomain() {
        assertThat(chain.admit("https://www.example.com/news/1", null)).isTrue();
        assertThat(chain.admit("https://EXAMPLE.com/news/1", null)).isTrue();
        assertThat(chain.admit("https://notexample.com/news/1", null)).isFalse();
        assertThat(chain.admit("https://example.com.evil.org/news/1", null)).isFalse();
    }

    @Test
    void seedRedirectsAreOnlyHostScoped() {
        assertThat(chain.admitRedirect("https://www.example.com/", true)).isTrue();
        assertThat(chain.admitRedirect("https://other.com/news/1", true)).isFalse();
        assertThat(chain.admitRedirect("https://www.example.com/", false)).isFalse();
        assertThat(chain.admitRedirect("https://www.example.com/news/2", false)).isTrue();
    }

    @Test
    void responseAdmissionOnlyChecksContentType() {
        // the seed is never pattern-checked, post-fetch only the content type matters
        assertThat(chain.admitResponse("https://example.com/", "text/html")).isTrue();
        assertThat(chain.admitResponse("https://example.com/", "TEXT/HTML;charset=utf-8")).isTrue();
        assertThat(chain.admitResponse("https://example.com/", "image/png")).isFalse();
        assertThat(chain.admitResponse("https://example.com/", null)).isTrue();
    }

    @Test
    void standardChainIsDomainThenPatternThenContentType() {
        assertThat(chain.getFilters()).hasExactlyElementsOfTypes(
                DomainFilter.class, UrlPatternFilter.class, ContentTypeFilter.class);
        UrlPatternFilter patterns = (UrlPatternFilter) chain.getFilters().get(1);
        assertThat(patterns.getPatterns()).extracting(GlobPattern::getGlob).containsExactly("*/news/*");
    }

    @Test
    void shortCircuitsOnFirstRejection() {
        List<String> calls = new ArrayList<>();
        FilterChain custom = new FilterChain(List.of(
                (url, ct) -> { calls.add("first"); return false; },
                (url, ct) -> { calls.add("second"); return true; }
        ));
        assertThat(custom.admit("https://example.com/", null)).isFalse();
        assertThat(calls).containsExactly("first");
    }

    @Test
    void emptyPatternListMatchesAll() {
        FilterChain open = FilterChain.from(new FilterSpec(Set.of("example.com"), List.of(), Set.of()));
        assertThat(open.admit("https://example.com/anything", null)).isTrue();
        assertThat(open.admit("https://example.com/anything", "application/pdf")).isTrue();
    }

    @Test
    void emptyDomainSetIsConfigurationError() {
        assertThatThrownBy(() -> FilterChain.from(new FilterSpec(Set.of(), List.of("*"), Set.of("text/html"))))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("domain");
    }

    @Test
    void malformedPatternIsConfigurationError() {
        assertThatThrownBy(() -> FilterChain.from(FilterSpec.of("example.com", List.of("*[news"), "text/html")))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void contentTypePrimaryTokenIsNormalized() {
        assertThat(ContentTypeFilter.primaryType("Text/HTML; charset=UTF-8")).isEqualTo("text/html");
        assertThat(ContentTypeFilter.primaryType("  ")).isNull();
        assertThat(ContentTypeFilter.primaryType(null)).isNull();
    }

    @Test
    void domainFilterIgnoresUnparseableUrls() {
        DomainFilter f = new DomainFilter(List.of(".Example.com"));
        assertThat(f.getAllowedDomains()).containsExactly("example.com");
        assertThat(f.admit("not a url", null)).isFalse();
        assertThat(f.admit("https://a.b.example.com/", null)).isTrue();
    }
}

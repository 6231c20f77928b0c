package com.scaniq.collector.service.search;

/**
 * A templated search query. {@code {company}} and {@code {domain}} are substituted at run time.
 *
 * @param template     query text with placeholders
 * @param type         short query type used in audit output
 * @param evidenceType type given to evidence produced by this query
 */
public record SearchQuery(String template, String type, String evidenceType) {

    public static SearchQuery of(String template, String type) {
        return new SearchQuery(template, type, "search-" + type);
    }

    /**
     * Query whose evidence is typed directly with a category tag.
     */
    public static SearchQuery forCategory(String template, String category) {
        return new SearchQuery(template, category, category);
    }

    public String render(String company, String domain) {
        return template.replace("{company}", company).replace("{domain}", domain);
    }
}

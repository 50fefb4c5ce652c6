package com.contrastsecurity.appsource.provider;

import com.contrastsecurity.appsource.model.NewsArticle;

import java.util.List;

/**
 * A provider backed by a whole catalog document, which may also carry news.
 */
public interface CatalogProvider extends AppProvider {

    /**
     * @param ids app ids or article identifiers to keep, or null for every article
     */
    List<NewsArticle> fetchNews(List<String> ids);

    /**
     * Requested ids that the last {@link #fetchApps} call did not find.
     */
    List<String> getMissingIds();
}

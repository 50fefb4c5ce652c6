package com.contrastsecurity.appsource.provider;

import com.contrastsecurity.appsource.model.App;
import com.contrastsecurity.appsource.service.IdentityResolver.ResolvedIds;

import java.util.List;

/**
 * An upstream source of candidate apps.
 */
public interface AppProvider {

    /**
     * @param ids which apps to return; an unfiltered value returns everything the provider has
     */
    List<App> fetchApps(ResolvedIds ids);

    /**
     * Location this provider reads from, for logs.
     */
    String describe();
}

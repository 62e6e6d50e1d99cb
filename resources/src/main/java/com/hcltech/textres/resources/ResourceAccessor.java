package com.hcltech.textres.resources;

import com.hcltech.textres.resources.locale.LocaleKey;

/**
 * Hook for the host application's generated resource class. A resolver publishes itself here when it binds a
 * group, and forwards every active-locale change, so call sites written against the generated class are served
 * by the resolver.
 */
public interface ResourceAccessor {

    ResourceAccessor NONE = new ResourceAccessor() {
        @Override
        public void publish(ResourceResolver resolver) {
        }

        @Override
        public void setActiveLocale(LocaleKey locale) {
        }
    };

    void publish(ResourceResolver resolver);

    void setActiveLocale(LocaleKey locale);
}

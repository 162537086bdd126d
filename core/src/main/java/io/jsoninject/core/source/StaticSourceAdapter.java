package io.jsoninject.core.source;

import io.jsoninject.core.model.BindContext;
import io.jsoninject.core.model.InjectionRequest;
import io.jsoninject.core.model.JsonPayload;
import io.jsoninject.core.model.SourceType;
import io.jsoninject.core.spi.SourceAdapter;

/** Returns the configured JSON text unmodified. */
public final class StaticSourceAdapter implements SourceAdapter {

    @Override
    public SourceType type() {
        return SourceType.STATIC_JSON;
    }

    @Override
    public JsonPayload produce(InjectionRequest request, BindContext binds) {
        return JsonPayload.of(request.staticText());
    }
}

// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.http.model;

import io.pfive.logtail.model.Source;
import io.pfive.logtail.registry.RejectedSource;
import io.pfive.logtail.registry.SourceRegistry;

import java.util.ArrayList;
import java.util.Locale;
import java.util.List;

/// Response body of the source listing endpoint.
public record SourceList (List<SourceItem> sources, List<RejectedItem> rejected) {

    public record SourceItem (
        String id, String name, String kind, String host, String path, String origin,
        boolean tailing, String state, int subscribers
    ) { }

    public record RejectedItem (String id, String name, String host, String path, String reason, String message) { }

    public static SourceList from (List<SourceRegistry.SourceStatus> statuses, List<RejectedSource> rejectedSources) {
        List<SourceItem> sources = new ArrayList<>();
        for (SourceRegistry.SourceStatus status : statuses) {
            Source source = status.source();
            sources.add(new SourceItem(source.id, source.name, source.kind.name().toLowerCase(Locale.ROOT).replace('_', '-'),
                source.host == null ? null : source.host.key(), source.path, source.origin,
                status.tailing(), status.state().name(), status.subscribers()));
        }
        List<RejectedItem> rejected = new ArrayList<>();
        for (RejectedSource r : rejectedSources) {
            rejected.add(new RejectedItem(r.id(), r.name(), r.host(), r.path(), r.violation().wireName, r.reason()));
        }
        return new SourceList(sources, rejected);
    }
}

package com.e2eq.odata.batch;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * One part of a {@code $batch} request body: a single request or a changeset of requests.
 */
public interface BatchPart {

    record Request(String method, String url, Map<String, String> headers, String body) implements BatchPart {
        public Request {
            TreeMap<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
            if (headers != null) {
                copy.putAll(headers);
            }
            headers = copy;
        }

        public Request(String method, String url) {
            this(method, url, Map.of(), null);
        }
    }

    record Changeset(List<Request> requests) implements BatchPart {
        public Changeset {
            requests = List.copyOf(requests);
        }
    }
}

/*
 * Copyright 2020 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.eventide.eventstore.api;

import org.eventide.event.EventEnvelope;
import org.eventide.event.EventStream;

import java.util.List;

/**
 * Notified with the envelopes of every successful append, after they've been written.
 */
@FunctionalInterface
public interface EventEnvelopeListener {
    EventEnvelopeListener NOOP = (collection, stream, envelopes) -> {
    };

    void onAppended(String collection, EventStream stream, List<EventEnvelope> envelopes);
}

package com.github.fsmgen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fsmgen.FsmGenException.Code;

/**
 * The graph-wide, deduplicated and stably ordered set of canonical events. Events are ordered by
 * first discovery: nodes in graph order and, per node, outgoing edges in discovery order. The
 * unconditional marker is never part of the catalog.
 * 
 * The catalog also remembers the canonical event of every edge, so that reaction tables built
 * later look events up here instead of re-deriving them on their own.
 */
public final class EventCatalog {
  private static final Logger logger = LogManager.getLogger(EventCatalog.class.getSimpleName());

  // K=event id, V=event. Insertion ordered.
  private final Map<String, CanonicalEvent> events;
  private final Map<GraphEdge, CanonicalEvent> edgeEvents;

  private EventCatalog(final Map<String, CanonicalEvent> events,
      final Map<GraphEdge, CanonicalEvent> edgeEvents) {
    this.events = events;
    this.edgeEvents = edgeEvents;
  }

  /**
   * Canonicalize every edge label of the graph. Fails on the first label that matches none of the
   * recognized forms, and when a named label and a timer label produce the same event.
   */
  public static EventCatalog build(final StateGraph graph) throws FsmGenException {
    final Map<String, CanonicalEvent> events = new LinkedHashMap<>();
    final Map<GraphEdge, CanonicalEvent> edgeEvents = new IdentityHashMap<>();
    // K=event id, V=label of the edge that introduced it
    final Map<String, String> firstLabels = new HashMap<>();
    for (final GraphNode node : graph.nodes()) {
      for (final GraphEdge edge : graph.outgoing(node)) {
        final CanonicalEvent event = EventNamer.canonicalize(edge.getLabel());
        edgeEvents.put(edge, event);
        if (event.isUnconditional()) {
          continue;
        }
        final CanonicalEvent known = events.putIfAbsent(event.getId(), event);
        if (known == null) {
          firstLabels.put(event.getId(), edge.getLabel());
        } else if (known.getKind() != event.getKind()) {
          throw new FsmGenException(Code.INVALID_EVENT_LABEL,
              String.format("Invalid event name: labels '%s' and '%s' both map to %s, "
                  + "one as a timer and one as a named event", firstLabels.get(event.getId()),
                  edge.getLabel(), event.getId()));
        }
      }
    }
    final EventCatalog catalog = new EventCatalog(events, edgeEvents);
    logger.info("Built event catalog of " + events.size() + " events ("
        + catalog.timerEvents().size() + " timers) from " + edgeEvents.size() + " edges");
    if (logger.isDebugEnabled()) {
      logger.debug("Event catalog: " + events.values());
    }
    return catalog;
  }

  public List<CanonicalEvent> events() {
    return Collections.unmodifiableList(new ArrayList<>(events.values()));
  }

  /**
   * Timer-backed events in catalog order. Position in this list is the timer's enum value.
   */
  public List<CanonicalEvent> timerEvents() {
    final List<CanonicalEvent> timers = new ArrayList<>();
    for (final CanonicalEvent event : events.values()) {
      if (event.isTimer()) {
        timers.add(event);
      }
    }
    return Collections.unmodifiableList(timers);
  }

  public boolean contains(final String eventId) {
    return events.containsKey(eventId);
  }

  public int size() {
    return events.size();
  }

  /**
   * Canonical event of an edge of the graph this catalog was built from.
   */
  public CanonicalEvent eventOf(final GraphEdge edge) throws FsmGenException {
    final CanonicalEvent event = edgeEvents.get(edge);
    return event != null ? event : EventNamer.canonicalize(edge.getLabel());
  }

  @Override
  public String toString() {
    return "EventCatalog [events=" + events.values() + "]";
  }
}

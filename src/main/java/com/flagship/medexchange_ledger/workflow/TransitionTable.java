package com.flagship.medexchange_ledger.workflow;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Allowed status transitions of one workflow and the actor relations entitled
 * to perform each. Anything not listed is rejected.
 */
public final class TransitionTable<S extends Enum<S>> {

    private final Class<S> type;
    private final Map<S, Map<S, Set<ActorRelation>>> transitions;

    private TransitionTable(Class<S> type, Map<S, Map<S, Set<ActorRelation>>> transitions) {
        this.type = type;
        this.transitions = transitions;
    }

    public static <S extends Enum<S>> Builder<S> builder(Class<S> type) {
        return new Builder<>(type);
    }

    public boolean allows(S from, S to) {
        return !actorsFor(from, to).isEmpty();
    }

    /**
     * @return relations allowed to move {@code from -> to}, empty when the transition does not exist
     */
    public Set<ActorRelation> actorsFor(S from, S to) {
        if (from == null || to == null) {
            return Set.of();
        }
        return transitions.getOrDefault(from, Map.of()).getOrDefault(to, Set.of());
    }

    public boolean permits(S from, S to, Set<ActorRelation> callerRelations) {
        return actorsFor(from, to).stream().anyMatch(callerRelations::contains);
    }

    public Set<S> targetsFrom(S from) {
        Map<S, Set<ActorRelation>> targets = transitions.get(from);
        return targets == null ? EnumSet.noneOf(type) : EnumSet.copyOf(targets.keySet());
    }

    public static final class Builder<S extends Enum<S>> {

        private final Class<S> type;
        private final Map<S, Map<S, Set<ActorRelation>>> transitions;

        private Builder(Class<S> type) {
            this.type = type;
            this.transitions = new EnumMap<>(type);
        }

        public Builder<S> allow(S from, S to, ActorRelation actor, ActorRelation... more) {
            transitions.computeIfAbsent(from, key -> new EnumMap<>(type))
                    .computeIfAbsent(to, key -> EnumSet.noneOf(ActorRelation.class))
                    .addAll(EnumSet.of(actor, more));
            return this;
        }

        public TransitionTable<S> build() {
            Map<S, Map<S, Set<ActorRelation>>> frozen = new EnumMap<>(type);
            transitions.forEach((from, targets) -> {
                Map<S, Set<ActorRelation>> copy = new EnumMap<>(type);
                targets.forEach((to, actors) -> copy.put(to, Collections.unmodifiableSet(EnumSet.copyOf(actors))));
                frozen.put(from, Collections.unmodifiableMap(copy));
            });
            return new TransitionTable<>(type, Collections.unmodifiableMap(frozen));
        }
    }
}

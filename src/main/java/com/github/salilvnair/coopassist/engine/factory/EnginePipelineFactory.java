package com.github.salilvnair.coopassist.engine.factory;

import com.github.salilvnair.coopassist.engine.exception.CoopAssistErrorCode;
import com.github.salilvnair.coopassist.engine.exception.CoopAssistException;
import com.github.salilvnair.coopassist.engine.pipeline.EnginePipeline;
import com.github.salilvnair.coopassist.engine.pipeline.EngineStep;
import com.github.salilvnair.coopassist.engine.pipeline.StepResult;
import com.github.salilvnair.coopassist.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.coopassist.engine.pipeline.annotation.MustRunBefore;
import com.github.salilvnair.coopassist.engine.pipeline.annotation.TerminalStep;
import com.github.salilvnair.coopassist.engine.session.EngineSession;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.support.AopUtils;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

@Slf4j
@RequiredArgsConstructor
@Component
public class EnginePipelineFactory {

    private final List<EngineStep> discoveredSteps;

    private EnginePipeline pipeline;

    // ---------------------------------------------------------------------
    // Init
    // ---------------------------------------------------------------------
    @PostConstruct
    public void init() {
        List<EngineStep> ordered = orderByDag(discoveredSteps);
        log.info("Co-op Assist pipeline order: {}",
                ordered.stream().map(s -> stepClass(s).getSimpleName()).collect(Collectors.joining(" -> ")));
        this.pipeline = new EnginePipeline(wrapWithTiming(ordered));
    }

    public EnginePipeline create() {
        return pipeline;
    }

    // ---------------------------------------------------------------------
    // DAG ordering using annotations
    // ---------------------------------------------------------------------
    List<EngineStep> orderByDag(List<EngineStep> steps) {

        Map<Class<?>, EngineStep> stepByClass = new LinkedHashMap<>();
        for (EngineStep s : steps) {
            if (stepByClass.put(stepClass(s), s) != null) {
                throw new CoopAssistException(
                        CoopAssistErrorCode.DUPLICATE_ENGINE_STEP,
                        "Duplicate EngineStep bean for class: " + stepClass(s).getName()
                );
            }
        }

        List<Class<?>> terminalSteps = stepByClass.keySet().stream()
                .filter(c -> c.getAnnotation(TerminalStep.class) != null)
                .toList();

        if (terminalSteps.size() != 1) {
            throw new CoopAssistException(
                    CoopAssistErrorCode.MISSING_TERMINAL_STEP,
                    "Exactly ONE @TerminalStep required, found: " +
                            terminalSteps.stream()
                                    .map(Class::getSimpleName)
                                    .collect(Collectors.joining(", "))
            );
        }

        Class<?> terminal = terminalSteps.get(0);

        Map<Class<?>, Set<Class<?>>> outgoing = new HashMap<>();
        Map<Class<?>, Set<Class<?>>> incoming = new HashMap<>();
        for (Class<?> c : stepByClass.keySet()) {
            outgoing.put(c, new LinkedHashSet<>());
            incoming.put(c, new LinkedHashSet<>());
        }

        for (Class<?> c : stepByClass.keySet()) {
            MustRunBefore before = c.getAnnotation(MustRunBefore.class);
            if (before != null) {
                for (Class<? extends EngineStep> b : before.value()) {
                    requirePresent(stepByClass, c, b);
                    addEdge(outgoing, incoming, c, b);
                }
            }
        }

        // A must run after B => B -> A
        for (Class<?> c : stepByClass.keySet()) {
            MustRunAfter after = c.getAnnotation(MustRunAfter.class);
            if (after != null) {
                for (Class<? extends EngineStep> a : after.value()) {
                    requirePresent(stepByClass, c, a);
                    addEdge(outgoing, incoming, a, c);
                }
            }
        }

        for (Class<?> c : stepByClass.keySet()) {
            if (!c.equals(terminal)) {
                addEdge(outgoing, incoming, c, terminal);
            }
        }

        List<Class<?>> sorted = topoSort(stepByClass.keySet(), outgoing, incoming);
        return sorted.stream().map(stepByClass::get).toList();
    }

    private void requirePresent(Map<Class<?>, EngineStep> stepByClass, Class<?> owner, Class<?> dep) {
        if (!stepByClass.containsKey(dep)) {
            throw new CoopAssistException(
                    CoopAssistErrorCode.MISSING_DEPENDENT_STEP,
                    owner.getSimpleName() + " depends on missing step: " + dep.getName()
            );
        }
    }

    private void addEdge(Map<Class<?>, Set<Class<?>>> outgoing,
                         Map<Class<?>, Set<Class<?>>> incoming,
                         Class<?> from,
                         Class<?> to) {
        if (from.equals(to)) return;
        if (outgoing.get(from).add(to)) {
            incoming.get(to).add(from);
        }
    }

    private List<Class<?>> topoSort(Set<Class<?>> nodes,
                                    Map<Class<?>, Set<Class<?>>> outgoing,
                                    Map<Class<?>, Set<Class<?>>> incoming) {

        Map<Class<?>, Integer> indegree = new HashMap<>();
        for (Class<?> n : nodes) {
            indegree.put(n, incoming.get(n).size());
        }

        PriorityQueue<Class<?>> q = new PriorityQueue<>(Comparator.comparing(Class::getName));
        indegree.forEach((k, v) -> {
            if (v == 0) q.add(k);
        });

        List<Class<?>> result = new ArrayList<>();
        while (!q.isEmpty()) {
            Class<?> n = q.poll();
            result.add(n);
            for (Class<?> m : outgoing.get(n)) {
                indegree.put(m, indegree.get(m) - 1);
                if (indegree.get(m) == 0) q.add(m);
            }
        }

        if (result.size() != nodes.size()) {
            Set<Class<?>> remaining = new LinkedHashSet<>(nodes);
            result.forEach(remaining::remove);
            throw new CoopAssistException(
                    CoopAssistErrorCode.PIPELINE_STEP_CYCLE,
                    "EngineStep DAG cycle or unsatisfied constraints: " +
                            remaining.stream()
                                    .map(Class::getSimpleName)
                                    .collect(Collectors.joining(" -> "))
            );
        }
        return result;
    }

    private static Class<?> stepClass(EngineStep step) {
        return AopUtils.getTargetClass(step);
    }

    // ---------------------------------------------------------------------
    // Timing wrapper
    // ---------------------------------------------------------------------
    private List<EngineStep> wrapWithTiming(List<EngineStep> steps) {
        return steps.stream().<EngineStep>map(TimingEngineStep::new).toList();
    }

    private static final class TimingEngineStep implements EngineStep {

        private final EngineStep delegate;
        private final String name;

        private TimingEngineStep(EngineStep delegate) {
            this.delegate = delegate;
            this.name = stepClass(delegate).getSimpleName();
        }

        @Override
        public StepResult execute(EngineSession session) {
            long start = System.nanoTime();
            try {
                StepResult result = delegate.execute(session);
                log.debug("Co-op Assist step {} user={} took {}µs -> {}",
                        name, session.getUserId(), (System.nanoTime() - start) / 1_000L,
                        result.getClass().getSimpleName());
                return result;
            } catch (RuntimeException ex) {
                log.debug("Co-op Assist step {} user={} failed after {}µs: {}",
                        name, session.getUserId(), (System.nanoTime() - start) / 1_000L, ex.getMessage());
                throw ex;
            }
        }
    }
}

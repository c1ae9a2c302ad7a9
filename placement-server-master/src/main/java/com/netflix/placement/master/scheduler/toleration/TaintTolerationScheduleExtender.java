/*
 * Copyright 2021 Netflix, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.netflix.placement.master.scheduler.toleration;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.google.common.math.LongMath;
import com.netflix.placement.api.cluster.model.ManagedCluster;
import com.netflix.placement.api.cluster.model.Taint;
import com.netflix.placement.api.placement.model.Placement;
import com.netflix.placement.api.placement.model.sanitizer.PlacementAssertions;
import com.netflix.placement.api.scheduler.model.ClusterRejection;
import com.netflix.placement.api.scheduler.model.ClusterRejection.Reason;
import com.netflix.placement.api.scheduler.model.ScheduleOutcome;
import com.netflix.placement.api.scheduler.service.ScheduleDecisionExtender;
import com.netflix.placement.api.scheduler.service.SchedulerException;
import com.netflix.placement.common.runtime.PlacementRuntime;
import com.netflix.placement.master.scheduler.SchedulerConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.netflix.placement.common.util.DateTimeExt.toTimeUnitString;

/**
 * Filters candidate clusters by taints and tolerations, and computes the placement requeue delay.
 * <p>
 * A cluster is rejected if any of its taints is not tolerated, or if the toleration time of any of its taints
 * has elapsed. For the admitted clusters, the time left until the first toleration expires is computed, and the
 * smallest value across all admitted clusters becomes the placement requeue delay. Expired clusters do not
 * contribute to the requeue delay, as they are rejected already.
 */
@Singleton
public class TaintTolerationScheduleExtender implements ScheduleDecisionExtender {

    private static final Logger logger = LoggerFactory.getLogger(TaintTolerationScheduleExtender.class);

    private final SchedulerConfiguration configuration;
    private final PlacementAssertions placementAssertions;
    private final TaintTolerationMetrics metrics;

    @Inject
    public TaintTolerationScheduleExtender(SchedulerConfiguration configuration, PlacementRuntime runtime) {
        this.configuration = configuration;
        this.placementAssertions = new PlacementAssertions();
        this.metrics = new TaintTolerationMetrics(runtime);
    }

    @Override
    public Map<String, String> validate(Placement placement) {
        return placementAssertions.validateTolerations(placement);
    }

    @Override
    public ScheduleOutcome schedule(Placement placement, List<ManagedCluster> candidates, Set<String> existingDecision, long now) {
        if (!configuration.isTaintTolerationEnabled()) {
            ScheduleOutcome.Builder builder = ScheduleOutcome.newBuilder().withPlacementId(placement.getId());
            candidates.forEach(cluster -> builder.withAdmittedCluster(cluster.getName()));
            return builder.build();
        }

        Map<String, String> violations = validate(placement);
        if (!violations.isEmpty()) {
            return rejectInvalidPlacement(placement, candidates, violations);
        }

        ScheduleOutcome.Builder builder = ScheduleOutcome.newBuilder().withPlacementId(placement.getId());
        Map<String, String> evaluationViolations = new LinkedHashMap<>();
        Duration minRemaining = null;

        for (ManagedCluster cluster : candidates) {
            TolerationResult result = TaintTolerationMatcher.tolerated(
                    cluster.getTaints(),
                    placement.getTolerations(),
                    existingDecision.contains(cluster.getName())
            );
            if (!result.isAdmitted()) {
                Taint taint = result.getUntoleratedTaint().orElse(null);
                builder.withRejection(reject(placement, cluster, Reason.UntoleratedTaint, String.format("Taint %s is not tolerated", formatTaint(taint))));
                continue;
            }

            checkExpiringTolerations(result.getToleratedExpiring(), now, evaluationViolations);

            Optional<ExpiringToleration> earliestOpt = TolerationExpiryAggregator.findEarliestExpiring(result.getToleratedExpiring(), now);
            if (!earliestOpt.isPresent()) {
                builder.withAdmittedCluster(admit(placement, cluster, "tolerated forever"));
                continue;
            }

            ExpiringToleration earliest = earliestOpt.get();
            Duration remaining = TolerationExpiryAggregator.remaining(earliest, now);
            if (remaining.isNegative() || remaining.isZero()) {
                String message = String.format("Toleration of taint %s expired %s ago",
                        formatTaint(earliest.getTaint()), toTimeUnitString(LongMath.saturatedSubtract(0L, remaining.toMillis())));
                builder.withRejection(reject(placement, cluster, Reason.TolerationExpired, message));
            } else {
                builder.withAdmittedCluster(admit(placement, cluster, "taint " + formatTaint(earliest.getTaint()) + " tolerated for " + toTimeUnitString(remaining)));
                if (minRemaining == null || remaining.compareTo(minRemaining) < 0) {
                    minRemaining = remaining;
                }
            }
        }

        if (!evaluationViolations.isEmpty()) {
            return rejectInvalidPlacement(placement, candidates, evaluationViolations);
        }

        if (minRemaining != null) {
            Duration requeueAfter = limitRequeueDelay(minRemaining);
            metrics.requeue(requeueAfter);
            builder.withRequeueAfter(requeueAfter);
            logger.debug("[{}] Requeue requested in {}", placement.getId(), toTimeUnitString(requeueAfter));
        }
        return recordMetrics(builder.build());
    }

    @Override
    public Map<String, ScheduleOutcome> scheduleAll(List<Placement> placements, List<ManagedCluster> candidates, long now) {
        Map<String, ScheduleOutcome> outcomes = new LinkedHashMap<>();
        for (Placement placement : placements) {
            ScheduleOutcome outcome;
            try {
                outcome = schedule(placement, candidates, now);
            } catch (RuntimeException e) {
                SchedulerException error = SchedulerException.evaluationError(placement, e);
                logger.error(error.getMessage(), e);
                metrics.evaluationFailure();
                outcome = recordMetrics(rejectAll(placement, candidates, Reason.EvaluationFailure, error.getMessage()).build());
            }
            outcomes.put(placement.getId(), outcome);
        }
        return outcomes;
    }

    /**
     * A negative toleration time combined with a taint added in the future cannot be evaluated consistently,
     * and is reported as a placement error.
     */
    private void checkExpiringTolerations(List<ExpiringToleration> toleratedExpiring, long now, Map<String, String> violations) {
        for (ExpiringToleration expiring : toleratedExpiring) {
            long timeAdded = expiring.getTaint().getTimeAdded().orElse(now);
            if (expiring.getTolerationSeconds() < 0 && timeAdded > now) {
                violations.put(
                        PlacementAssertions.tolerationPath(expiring.getTolerationIndex()) + ".tolerationSeconds",
                        String.format("negative toleration seconds cannot be applied to taint %s added in the future", formatTaint(expiring.getTaint()))
                );
            }
        }
    }

    private Duration limitRequeueDelay(Duration requeueAfter) {
        long maxRequeueDelayMs = configuration.getMaxRequeueDelayMs();
        if (maxRequeueDelayMs > 0 && requeueAfter.toMillis() > maxRequeueDelayMs) {
            return Duration.ofMillis(maxRequeueDelayMs);
        }
        return requeueAfter;
    }

    private ScheduleOutcome rejectInvalidPlacement(Placement placement, List<ManagedCluster> candidates, Map<String, String> violations) {
        logger.warn("[{}] Rejecting all {} candidate clusters due to invalid tolerations: {}", placement.getId(), candidates.size(), violations);
        metrics.validationFailure();
        return recordMetrics(rejectAll(placement, candidates, Reason.InvalidPlacement, "Invalid placement tolerations: " + violations)
                .withValidationErrors(violations)
                .build());
    }

    private ScheduleOutcome.Builder rejectAll(Placement placement, List<ManagedCluster> candidates, Reason reason, String message) {
        ScheduleOutcome.Builder builder = ScheduleOutcome.newBuilder().withPlacementId(placement.getId());
        candidates.forEach(cluster -> builder.withRejection(new ClusterRejection(cluster.getName(), reason, message)));
        return builder;
    }

    private ScheduleOutcome recordMetrics(ScheduleOutcome outcome) {
        outcome.getAdmittedClusters().forEach(cluster -> metrics.admitted());
        outcome.getRejections().values().forEach(rejection -> metrics.rejected(rejection.getReason()));
        return outcome;
    }

    private String admit(Placement placement, ManagedCluster cluster, String details) {
        logger.debug("[{}] Cluster {} admitted: {}", placement.getId(), cluster.getName(), details);
        return cluster.getName();
    }

    private ClusterRejection reject(Placement placement, ManagedCluster cluster, Reason reason, String message) {
        logger.debug("[{}] Cluster {} rejected: {}", placement.getId(), cluster.getName(), message);
        return new ClusterRejection(cluster.getName(), reason, message);
    }

    private static String formatTaint(Taint taint) {
        if (taint == null) {
            return "<none>";
        }
        return taint.getKey() + '=' + taint.getValue() + ':' + taint.getEffect();
    }
}

/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.ecod.state;

import static com.amazon.ecod.CommonUtils.checkArgument;
import static com.amazon.ecod.CommonUtils.checkNotNull;

import lombok.Getter;
import lombok.Setter;

import com.amazon.ecod.ECODModel;
import com.amazon.ecod.cdf.EmpiricalCDF;
import com.amazon.ecod.cdf.Tail;
import com.amazon.ecod.executor.AbstractScoringExecutor;
import com.amazon.ecod.executor.ParallelScoringExecutor;
import com.amazon.ecod.executor.SequentialScoringExecutor;
import com.amazon.ecod.threshold.Calibration;

@Getter
@Setter
public class ECODModelMapper implements IStateMapper<ECODModel, ECODModelState> {

    /**
     * If true, the execution settings of the model are saved and restored; if
     * false a restored model scores sequentially.
     */
    private boolean saveExecutorContext = false;

    @Override
    public ECODModelState toState(ECODModel model) {
        checkNotNull(model, "model must not be null");
        ECODModelState state = new ECODModelState();
        state.setContamination(model.getContamination());
        state.setDimensions(model.getDimensions());

        double[][] references = new double[model.getDimensions()][];
        for (int f = 0; f < references.length; f++) {
            references[f] = model.getReference(f, Tail.LEFT).getSortedReference();
        }
        state.setReferences(references);
        state.setDecisionScores(model.getDecisionScores());
        state.setThreshold(model.getThreshold());
        state.setLabels(model.getLabels());

        if (saveExecutorContext && model.getExecutor() instanceof ParallelScoringExecutor) {
            state.setParallelExecutionEnabled(true);
            state.setThreadPoolSize(((ParallelScoringExecutor) model.getExecutor()).getThreadPoolSize());
        }
        return state;
    }

    @Override
    public ECODModel toModel(ECODModelState state) {
        checkNotNull(state, "state must not be null");
        checkNotNull(state.getReferences(), "references must not be null");
        checkNotNull(state.getDecisionScores(), "decisionScores must not be null");
        checkArgument(state.getReferences().length == state.getDimensions(), "incorrect number of references");
        for (double[] reference : state.getReferences()) {
            checkArgument(reference != null && reference.length == state.getDecisionScores().length,
                    "each reference must hold one value per training row");
        }

        int dimensions = state.getDimensions();
        EmpiricalCDF[] leftReferences = new EmpiricalCDF[dimensions];
        EmpiricalCDF[] rightReferences = new EmpiricalCDF[dimensions];
        for (int f = 0; f < dimensions; f++) {
            leftReferences[f] = EmpiricalCDF.fromSorted(state.getReferences()[f]);
            rightReferences[f] = EmpiricalCDF.forTail(state.getReferences()[f], Tail.RIGHT);
        }

        AbstractScoringExecutor executor;
        if (saveExecutorContext && state.isParallelExecutionEnabled()) {
            executor = new ParallelScoringExecutor(state.getThreadPoolSize());
        } else {
            executor = new SequentialScoringExecutor();
        }

        Calibration calibration = new Calibration(state.getThreshold(), state.getLabels());
        return new ECODModel(leftReferences, rightReferences, state.getDecisionScores(), calibration,
                state.getContamination(), executor);
    }
}

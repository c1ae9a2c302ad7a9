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

package com.netflix.placement.api.scheduler.service;

import com.netflix.placement.api.placement.model.Placement;

public class SchedulerException extends RuntimeException {

    public enum ErrorCode {
        InvalidArgument,
        EvaluationError
    }

    private final ErrorCode errorCode;

    public SchedulerException(ErrorCode errorCode, String message, Throwable cause, Object... args) {
        super(String.format(message, args), cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public static SchedulerException invalidArgument(String message, Object... args) {
        return new SchedulerException(ErrorCode.InvalidArgument, message, null, args);
    }

    public static SchedulerException evaluationError(Placement placement, Throwable cause) {
        return new SchedulerException(ErrorCode.EvaluationError, "Cannot evaluate taints and tolerations of placement %s: %s", cause,
                placement.getId(), cause.getMessage());
    }
}

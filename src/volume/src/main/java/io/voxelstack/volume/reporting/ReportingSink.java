/*
 * (c) Copyright 2025 Multiversio LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *          http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.voxelstack.volume.reporting;

/**
 * Receives progress, warnings and informational messages from the volume pipeline.
 * <p>
 * Calls are made synchronously on the loading thread, in pipeline order. Implementations must
 * return promptly. Warnings and messages are notifications only: they never abort a load.
 */
public interface ReportingSink {

    /**
     * Starts a progress phase.
     *
     * @param label a short description of the phase
     */
    void showProgress(String label);

    /**
     * @param percent progress of the current phase, 0 to 100
     */
    void updateProgress(int percent);

    /** Ends the current progress phase. */
    void completeProgress();

    /**
     * @param code a stable identifier, {@code Component:Reason}
     * @param text a human-readable explanation
     */
    void showWarning(String code, String text);

    /**
     * @param code a stable identifier, {@code Component:Reason}
     * @param text a human-readable explanation
     */
    void showMessage(String code, String text);
}

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

import lombok.extern.slf4j.Slf4j;

/**
 * {@link ReportingSink} writing to SLF4J: warnings at WARN, messages at INFO, progress at DEBUG.
 */
@Slf4j
public class LoggingReportingSink implements ReportingSink {

    private String label = "";

    @Override
    public void showProgress(String label) {
        this.label = label == null ? "" : label;
        log.debug("{}...", this.label);
    }

    @Override
    public void updateProgress(int percent) {
        log.debug("{}: {}%", label, percent);
    }

    @Override
    public void completeProgress() {
        log.debug("{}: done", label);
    }

    @Override
    public void showWarning(String code, String text) {
        log.warn("[{}] {}", code, text);
    }

    @Override
    public void showMessage(String code, String text) {
        log.info("[{}] {}", code, text);
    }
}

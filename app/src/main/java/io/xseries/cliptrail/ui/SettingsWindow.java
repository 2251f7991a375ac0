/*
 * ClipTrail — Clipboard History & Search
 * Copyright (C) 2026 Rafael Xudoynazarov (XCON | RX)
 * SPDX-License-Identifier: GPL-3.0-only
 */
package io.xseries.cliptrail.ui;

import io.xseries.cliptrail.config.AppPaths;
import io.xseries.cliptrail.config.Config;
import io.xseries.cliptrail.config.SettingsService;
import io.xseries.cliptrail.system.clipboard.WatcherController;
import javafx.animation.PauseTransition;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.Scene;
import javafx.scene.control.*;
import javafx.scene.layout.*;
import javafx.stage.Modality;
import javafx.stage.Stage;
import javafx.stage.StageStyle;
import javafx.util.Duration;
import javafx.util.StringConverter;

import java.net.URL;
import java.util.Objects;

/**
 * Settings window.
 *
 * Apply pushes every field through {@link SettingsService}, which writes config.json
 * and updates runtime behavior.
 */
public final class SettingsWindow {

    private final Stage stage;

    private final SettingsService settings;
    private final WatcherController watcherController;

    private final Spinner<Integer> historyLimit;
    private final CheckBox persistHistory;
    private final CheckBox fuzzyMatching;
    private final CheckBox captureEnabled;

    private final Button applyBtn = new Button("Apply");
    private boolean internalSync = false;

    // Status (toast-like) label shown in bottom bar
    private final Label statusLabel = new Label();
    private final PauseTransition statusHide = new PauseTransition(Duration.millis(1800));

    public SettingsWindow(SettingsService settings, WatcherController watcherController) {
        this.settings = Objects.requireNonNull(settings);
        this.watcherController = Objects.requireNonNull(watcherController);

        this.stage = new Stage(StageStyle.DECORATED);
        stage.setTitle("ClipTrail Settings");
        stage.initModality(Modality.APPLICATION_MODAL);
        stage.setResizable(false);

        historyLimit = new Spinner<>(1, Config.MAX_HISTORY_LIMIT, settings.historyLimit(), 10);
        historyLimit.setEditable(true);
        historyLimit.getEditor().setTextFormatter(
                new TextFormatter<>(change ->
                        change.getControlNewText().matches("\\d*") ? change : null
                )
        );

        // SAFE CONVERTER FOR historyLimit
        historyLimit.getValueFactory().setConverter(new StringConverter<>() {
            @Override
            public String toString(Integer value) {
                return value == null ? "" : value.toString();
            }

            @Override
            public Integer fromString(String text) {
                try {
                    historyLimit.getEditor().getStyleClass().remove("input-error");
                    return Integer.parseInt(text.trim());
                } catch (NumberFormatException e) {
                    historyLimit.getEditor().getStyleClass().add("input-error");
                    return historyLimit.getValue();
                }
            }
        });

        persistHistory = new CheckBox("Store history");
        persistHistory.setTooltip(new Tooltip("Save history on exit and restore it on start"));

        fuzzyMatching = new CheckBox("Fuzzy matching");
        fuzzyMatching.setTooltip(new Tooltip("Match query characters in order, gaps allowed"));

        captureEnabled = new CheckBox("Enable clipboard capture");

        GridPane grid = new GridPane();
        grid.setHgap(10);
        grid.setVgap(10);

        int r = 0;
        grid.add(new Label("History limit:"), 0, r);
        grid.add(historyLimit, 1, r++);
        grid.add(persistHistory, 1, r++);
        grid.add(fuzzyMatching, 1, r++);
        grid.add(captureEnabled, 1, r++);

        Label dataDir = new Label("Data folder: " + AppPaths.dataDir());
        dataDir.getStyleClass().add("settings-hint");
        grid.add(dataDir, 0, r, 2, 1);

        ColumnConstraints c0 = new ColumnConstraints();
        c0.setMinWidth(120);
        ColumnConstraints c1 = new ColumnConstraints();
        c1.setHgrow(Priority.ALWAYS);
        grid.getColumnConstraints().addAll(c0, c1);

        Button closeBtn = new Button("Close");
        closeBtn.setOnAction(e -> stage.hide());

        applyBtn.setDefaultButton(true);
        applyBtn.setOnAction(e -> apply());

        statusLabel.setVisible(false);
        statusHide.setOnFinished(e -> statusLabel.setVisible(false));

        Region spacer = new Region();
        HBox.setHgrow(spacer, Priority.ALWAYS);
        HBox bottom = new HBox(8, statusLabel, spacer, applyBtn, closeBtn);
        bottom.setAlignment(Pos.CENTER_RIGHT);

        VBox root = new VBox(16, grid, bottom);
        root.setPadding(new Insets(16));

        Scene scene = new Scene(root);
        URL css = SettingsWindow.class.getResource("/ui/styles.css");
        if (css != null) scene.getStylesheets().add(css.toExternalForm());
        stage.setScene(scene);

        historyLimit.valueProperty().addListener((o, a, b) -> markDirty());
        persistHistory.selectedProperty().addListener((o, a, b) -> markDirty());
        fuzzyMatching.selectedProperty().addListener((o, a, b) -> markDirty());
        captureEnabled.selectedProperty().addListener((o, a, b) -> markDirty());
    }

    public void show() {
        syncFromSettings();
        if (!stage.isShowing()) stage.show();
        stage.toFront();
        stage.requestFocus();
    }

    private void syncFromSettings() {
        internalSync = true;
        try {
            historyLimit.getValueFactory().setValue(settings.historyLimit());
            persistHistory.setSelected(settings.persistHistory());
            fuzzyMatching.setSelected(settings.fuzzyMatching());
            captureEnabled.setSelected(watcherController.isEnabled());
            applyBtn.setDisable(true);
        } finally {
            internalSync = false;
        }
    }

    private void markDirty() {
        if (internalSync) return;
        applyBtn.setDisable(false);
    }

    private void apply() {
        // commit a value typed into the editor but not yet confirmed
        var factory = historyLimit.getValueFactory();
        factory.setValue(factory.getConverter().fromString(historyLimit.getEditor().getText()));

        Integer limit = historyLimit.getValue();
        boolean limitOk = limit != null && settings.setHistoryLimit(limit);

        settings.setPersistHistory(persistHistory.isSelected());
        settings.setFuzzyMatching(fuzzyMatching.isSelected());

        boolean capture = captureEnabled.isSelected();
        settings.setCaptureEnabled(capture);
        watcherController.setEnabled(capture);

        syncFromSettings();
        showStatus(limitOk ? "Settings saved" : "History limit unchanged");
    }

    private void showStatus(String text) {
        statusLabel.setText(text);
        statusLabel.setVisible(true);
        statusHide.playFromStart();
    }
}

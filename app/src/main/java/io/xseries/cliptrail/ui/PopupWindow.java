/*
 * ClipTrail — Clipboard History & Search
 * Copyright (C) 2026 Rafael Xudoynazarov (XCON | RX)
 * SPDX-License-Identifier: GPL-3.0-only
 */
package io.xseries.cliptrail.ui;

import io.xseries.cliptrail.domain.service.ClipAction;
import io.xseries.cliptrail.domain.service.ClipItem;
import io.xseries.cliptrail.domain.service.ClipService;
import javafx.animation.PauseTransition;
import javafx.application.Platform;
import javafx.collections.FXCollections;
import javafx.collections.ObservableList;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.geometry.Rectangle2D;
import javafx.scene.Scene;
import javafx.scene.control.*;
import javafx.scene.input.KeyCode;
import javafx.scene.input.KeyEvent;
import javafx.scene.input.MouseButton;
import javafx.scene.layout.*;
import javafx.stage.Screen;
import javafx.stage.Stage;
import javafx.stage.StageStyle;
import javafx.util.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.MouseInfo;
import java.awt.Point;
import java.net.URL;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Search popup: query field on top, ranked history below.
 *
 * Keys:
 * - Enter       first action of the selected (or first) result
 * - Delete      remove selected result
 * - Esc         clear query, then hide
 * - Ctrl+,      settings
 */
public final class PopupWindow {

    private static final Logger LOGGER = LoggerFactory.getLogger(PopupWindow.class);

    private static final int WIDTH = 520;
    private static final int HEIGHT = 420;

    // Preview behavior (prevents "text wall" in list)
    private static final int PREVIEW_LINES = 3;
    private static final int PREVIEW_CHAR_LIMIT = 320;

    private final Stage stage;
    private final TextField searchField = new TextField();
    private final ListView<ClipItem> listView = new ListView<>();
    private final ObservableList<ClipItem> items = FXCollections.observableArrayList();

    private final ClipService clipService;
    private final Runnable onOpenSettings;

    private final Label pausedBadge = new Label("PAUSED");
    private final Label countLabel = new Label();
    private final Label emptyStateLabel = new Label();
    private volatile boolean paused = false;

    private final PauseTransition searchDebounce = new PauseTransition(Duration.millis(120));
    private final PauseTransition autoHideDelay = new PauseTransition(Duration.millis(160));

    public PopupWindow(ClipService clipService, Runnable onOpenSettings) {
        this.clipService = Objects.requireNonNull(clipService);
        this.onOpenSettings = (onOpenSettings != null) ? onOpenSettings : (() -> {});

        stage = new Stage(StageStyle.UTILITY);
        stage.setTitle("ClipTrail");
        stage.setAlwaysOnTop(true);
        stage.setResizable(true);
        stage.setMinWidth(420);
        stage.setMinHeight(300);

        listView.setItems(items);
        listView.setCellFactory(lv -> new ItemCell());
        listView.getStyleClass().add("clip-list");

        emptyStateLabel.setWrapText(true);
        emptyStateLabel.setMaxWidth(360);
        emptyStateLabel.getStyleClass().add("empty-state");
        listView.setPlaceholder(emptyStateLabel);
        updateEmptyStateText();

        pausedBadge.setVisible(false);
        pausedBadge.setManaged(false);
        pausedBadge.getStyleClass().add("paused-badge");

        countLabel.getStyleClass().add("topbar-status");
        countLabel.setText("Clips: 0");

        searchField.setPromptText("Search…");
        searchField.setMaxWidth(Double.MAX_VALUE);
        searchField.getStyleClass().add("search-field");

        searchDebounce.setOnFinished(e -> reloadNow());
        searchField.textProperty().addListener((obs, o, n) -> searchDebounce.playFromStart());

        Button settingsBtn = new Button("Settings");
        settingsBtn.setFocusTraversable(false);
        settingsBtn.setTooltip(new Tooltip("Open settings (Ctrl+,)"));
        settingsBtn.setOnAction(e -> onOpenSettings.run());
        settingsBtn.getStyleClass().add("topbar-btn");

        HBox.setHgrow(searchField, Priority.ALWAYS);
        HBox topBar = new HBox(8, searchField, pausedBadge, countLabel, settingsBtn);
        topBar.getStyleClass().add("top-bar");
        topBar.setAlignment(Pos.CENTER_LEFT);
        topBar.setPadding(new Insets(8));

        BorderPane root = new BorderPane();
        root.setTop(topBar);
        root.setCenter(listView);

        Scene scene = new Scene(root, WIDTH, HEIGHT);
        URL css = PopupWindow.class.getResource("/ui/styles.css");
        if (css != null) scene.getStylesheets().add(css.toExternalForm());
        stage.setScene(scene);

        stage.setOnCloseRequest(e -> {
            e.consume();
            hide();
        });

        autoHideDelay.setOnFinished(e -> hide());
        stage.focusedProperty().addListener((o, was, now) -> {
            if (!now) autoHideDelay.playFromStart();
            else autoHideDelay.stop();
        });

        stage.addEventFilter(KeyEvent.KEY_PRESSED, this::onKeyPressed);
    }

    private void onKeyPressed(KeyEvent e) {
        if (e.isControlDown() && e.getCode() == KeyCode.COMMA) {
            e.consume();
            onOpenSettings.run();
            return;
        }
        if (e.getCode() == KeyCode.ESCAPE) {
            e.consume();
            if (!searchField.getText().isEmpty()) {
                searchField.clear();
                searchField.requestFocus();
            } else {
                hide();
            }
            return;
        }
        if (e.getCode() == KeyCode.ENTER) {
            e.consume();
            selectedOrFirst().flatMap(ClipItem::defaultAction).ifPresent(this::run);
            return;
        }
        if (e.getCode() == KeyCode.DELETE && !(e.getTarget() instanceof TextInputControl)) {
            e.consume();
            selectedOrFirst().flatMap(i -> i.action(ClipAction.REMOVE)).ifPresent(this::run);
            return;
        }
        if (e.getCode() == KeyCode.DOWN && e.getTarget() == searchField) {
            e.consume();
            listView.requestFocus();
            if (listView.getSelectionModel().isEmpty() && !items.isEmpty()) {
                listView.getSelectionModel().select(0);
            }
        }
    }

    private Optional<ClipItem> selectedOrFirst() {
        ClipItem selected = listView.getSelectionModel().getSelectedItem();
        if (selected != null) return Optional.of(selected);
        return items.isEmpty() ? Optional.empty() : Optional.of(items.get(0));
    }

    /**
     * Runs an action picked from a result. Removing keeps the popup open and refreshes,
     * every other action hides it first so a paste lands in the previous window.
     */
    private void run(ClipAction action) {
        try {
            if (ClipAction.REMOVE.equals(action.id())) {
                action.execute();
                reloadNow();
                return;
            }
            hide();
            action.execute();
        } catch (RuntimeException ex) {
            LOGGER.warn("Action '{}' failed", action.id(), ex);
        }
    }

    public void reloadNow() {
        String query = searchField.getText() == null ? "" : searchField.getText();
        List<ClipItem> result = clipService.query(query);

        items.setAll(result);
        countLabel.setText("Clips: " + clipService.history().size());
        updateEmptyStateText();

        if (!items.isEmpty()) {
            listView.getSelectionModel().clearAndSelect(0);
            listView.scrollTo(0);
        }
    }

    public void setPaused(boolean paused) {
        this.paused = paused;
        Platform.runLater(() -> {
            pausedBadge.setVisible(paused);
            pausedBadge.setManaged(paused);
            updateEmptyStateText();
        });
    }

    private void updateEmptyStateText() {
        if (paused) {
            emptyStateLabel.setText("Paused. Clipboard capture is turned off.\nResume capturing from the tray menu.");
            return;
        }

        String q = searchField.getText() == null ? "" : searchField.getText();
        if (!q.isEmpty()) {
            emptyStateLabel.setText("No results for \"" + q + "\".");
            return;
        }

        emptyStateLabel.setText("No clips yet.\nCopy any text and it will appear here.");
    }

    public void showOrFocus() {
        if (!stage.isShowing()) {
            positionNearMouse();
            stage.show();
        }

        stage.toFront();
        stage.requestFocus();

        searchField.requestFocus();
        searchField.selectAll();
        reloadNow();
    }

    public void hide() {
        autoHideDelay.stop();
        stage.hide();
    }

    private void positionNearMouse() {
        try {
            Point p = MouseInfo.getPointerInfo().getLocation();
            var screens = Screen.getScreensForRectangle(p.x, p.y, 1, 1);
            Rectangle2D b = (screens.isEmpty() ? Screen.getPrimary() : screens.get(0)).getVisualBounds();

            double x = Math.min(Math.max(p.x - WIDTH / 2.0, b.getMinX()), b.getMaxX() - WIDTH);
            double y = Math.min(Math.max(p.y - 40.0, b.getMinY()), b.getMaxY() - HEIGHT);
            stage.setX(x);
            stage.setY(y);
        } catch (Exception e) {
            LOGGER.debug("Cannot position popup near pointer", e);
            stage.centerOnScreen();
        }
    }

    static String preview(String text) {
        String t = text.length() > PREVIEW_CHAR_LIMIT ? text.substring(0, PREVIEW_CHAR_LIMIT) + "…" : text;
        String[] lines = t.split("\\R", PREVIEW_LINES + 1);
        if (lines.length <= PREVIEW_LINES) return t;
        return String.join("\n", java.util.Arrays.copyOf(lines, PREVIEW_LINES)) + "\n…";
    }

    // -----------------------
    // Cells
    // -----------------------
    private final class ItemCell extends ListCell<ClipItem> {

        private final Label content = new Label();
        private final Label subtitle = new Label();
        private final VBox box = new VBox(2, content, subtitle);

        ItemCell() {
            content.setWrapText(true);
            content.setMinWidth(0);
            content.setPrefWidth(0);
            content.setMaxWidth(Double.MAX_VALUE);
            content.getStyleClass().add("clip-content");
            subtitle.getStyleClass().add("clip-time");
            box.setPadding(new Insets(4, 6, 4, 6));

            setOnMouseClicked(ev -> {
                if (isEmpty() || getItem() == null) return;
                if (ev.getButton() == MouseButton.PRIMARY && ev.getClickCount() == 2) {
                    getItem().defaultAction().ifPresent(PopupWindow.this::run);
                }
            });

            setOnContextMenuRequested(ev -> {
                if (isEmpty() || getItem() == null) return;
                listView.getSelectionModel().clearAndSelect(getIndex());
                contextMenuFor(getItem()).show(this, ev.getScreenX(), ev.getScreenY());
                ev.consume();
            });
        }

        @Override
        protected void updateItem(ClipItem item, boolean empty) {
            super.updateItem(item, empty);

            if (empty || item == null) {
                setText(null);
                setGraphic(null);
                return;
            }

            content.setText(preview(item.text()));
            subtitle.setText(item.subtitle());
            setText(null);
            setGraphic(box);
        }

        private ContextMenu contextMenuFor(ClipItem item) {
            ContextMenu menu = new ContextMenu();
            for (ClipAction a : item.actions()) {
                MenuItem mi = new MenuItem(a.label());
                mi.setOnAction(e -> run(a));
                menu.getItems().add(mi);
            }
            return menu;
        }
    }
}

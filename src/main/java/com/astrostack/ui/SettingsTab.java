package com.astrostack.ui;

import com.astrostack.model.AppConfig;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.control.*;
import javafx.scene.layout.*;
import javafx.scene.text.Font;
import javafx.scene.text.FontWeight;
import javafx.stage.DirectoryChooser;
import javafx.stage.FileChooser;
import java.io.File;

public class SettingsTab {

    private TextField txtCutout, txtFwhmSat, txtDetectSat, txtMatchTol, txtShiftTh, txtThreads;
    private TextField txtAstapPath, txtAstapDb;
    private Label lblStatus;

    public Tab create() {
        Tab tab = new Tab("⚙️ Settings");
        BorderPane root = new BorderPane();
        root.setPadding(new Insets(20));

        VBox content = new VBox(20);
        content.setAlignment(Pos.TOP_CENTER);
        content.setMaxWidth(700);

        Label title = new Label("🔭 Pipeline Settings");
        title.setFont(Font.font("System", FontWeight.BOLD, 20));

        // --- 1. REGISTRATION ---
        GridPane grid = new GridPane();
        grid.setHgap(15); grid.setVgap(15);
        grid.setStyle("-fx-border-color: #CCC; -fx-padding: 15; -fx-background-color: #F9F9F9; -fx-background-radius: 5;");

        txtCutout = new TextField(String.valueOf(AppConfig.getFwhmCutoutHalfSize()));
        txtFwhmSat = new TextField(String.valueOf(AppConfig.getFwhmSaturation()));
        txtDetectSat = new TextField(String.valueOf(AppConfig.getDetectionSaturation()));
        txtMatchTol = new TextField(String.valueOf(AppConfig.getMatchTolerance()));
        txtShiftTh = new TextField(String.valueOf(AppConfig.getShiftThreshold()));
        txtThreads = new TextField(String.valueOf(AppConfig.getWorkerThreads()));

        grid.add(new Label("FWHM cutout half-size (px):"), 0, 0); grid.add(txtCutout, 1, 0);
        grid.add(new Label("FWHM saturation (ADU):"), 0, 1); grid.add(txtFwhmSat, 1, 1);
        grid.add(new Label("Detection saturation (ADU):"), 0, 2); grid.add(txtDetectSat, 1, 2);
        grid.add(new Label("Match tolerance (px):"), 0, 3); grid.add(txtMatchTol, 1, 3);
        grid.add(new Label("Minimum shift (px):"), 0, 4); grid.add(txtShiftTh, 1, 4);
        grid.add(new Label("Worker threads:"), 0, 5); grid.add(txtThreads, 1, 5);

        // --- 2. ASTAP ---
        VBox astapBox = new VBox(10);
        astapBox.setStyle("-fx-border-color: #FF9800; -fx-border-width: 1; -fx-padding: 15; -fx-background-radius: 5; -fx-background-color: #FFF3E0;");
        Label lblAstap = new Label("🗺️ Plate Solving (ASTAP)");
        lblAstap.setFont(Font.font("System", FontWeight.BOLD, 13));

        GridPane gridAstap = new GridPane();
        gridAstap.setHgap(10); gridAstap.setVgap(10);
        txtAstapPath = new TextField(AppConfig.getAstapPath());
        txtAstapPath.setPromptText("Path to the ASTAP executable");
        txtAstapPath.setPrefWidth(300);
        Button btnFindAstap = new Button("📂 App");
        btnFindAstap.setOnAction(e -> browseFile(txtAstapPath));
        txtAstapDb = new TextField(AppConfig.getAstapDbPath());
        txtAstapDb.setPromptText("Star database folder (g17/g18/h18)");
        txtAstapDb.setPrefWidth(300);
        Button btnFindDb = new Button("📂 DB");
        btnFindDb.setOnAction(e -> browseDir(txtAstapDb));
        gridAstap.add(new Label("ASTAP program:"), 0, 0); gridAstap.add(txtAstapPath, 1, 0); gridAstap.add(btnFindAstap, 2, 0);
        gridAstap.add(new Label("Database:"), 0, 1); gridAstap.add(txtAstapDb, 1, 1); gridAstap.add(btnFindDb, 2, 1);
        astapBox.getChildren().addAll(lblAstap, gridAstap);

        // --- FOOTER ---
        lblStatus = new Label("");
        Button btnSave = new Button("💾 Save");
        btnSave.setStyle("-fx-base: #4CAF50; -fx-text-fill: white; -fx-font-weight: bold; -fx-font-size: 14px;");
        btnSave.setOnAction(e -> save());

        content.getChildren().addAll(title, grid, astapBox, btnSave, lblStatus);
        root.setCenter(content);
        tab.setContent(root);
        return tab;
    }

    private void save() {
        try {
            AppConfig.setFwhmCutoutHalfSize(Integer.parseInt(txtCutout.getText().trim()));
            AppConfig.setFwhmSaturation(Double.parseDouble(txtFwhmSat.getText().trim()));
            AppConfig.setDetectionSaturation(Double.parseDouble(txtDetectSat.getText().trim()));
            AppConfig.setMatchTolerance(Double.parseDouble(txtMatchTol.getText().trim()));
            AppConfig.setShiftThreshold(Double.parseDouble(txtShiftTh.getText().trim()));
            AppConfig.setWorkerThreads(Math.max(1, Integer.parseInt(txtThreads.getText().trim())));
            AppConfig.setAstapPath(txtAstapPath.getText().trim());
            AppConfig.setAstapDbPath(txtAstapDb.getText().trim());
            lblStatus.setText("✅ Saved.");
            lblStatus.setStyle("-fx-text-fill: #2E7D32;");
        } catch (NumberFormatException ex) {
            lblStatus.setText("❌ Invalid number: " + ex.getMessage());
            lblStatus.setStyle("-fx-text-fill: #D32F2F;");
        }
    }

    private void browseFile(TextField tf) {
        FileChooser fc = new FileChooser();
        File f = fc.showOpenDialog(tf.getScene().getWindow());
        if (f != null) tf.setText(f.getAbsolutePath());
    }

    private void browseDir(TextField tf) {
        DirectoryChooser dc = new DirectoryChooser();
        File f = dc.showDialog(tf.getScene().getWindow());
        if (f != null) tf.setText(f.getAbsolutePath());
    }
}

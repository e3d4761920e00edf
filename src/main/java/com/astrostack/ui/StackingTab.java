package com.astrostack.ui;

import com.astrostack.model.AppConfig;
import com.astrostack.model.CelestialPoint;
import com.astrostack.model.FrameData;
import com.astrostack.model.PipelineSettings;
import com.astrostack.model.ReductionResult;
import com.astrostack.service.AstapPlateSolver;
import com.astrostack.service.FitsImageService;
import com.astrostack.service.ReductionPipeline;
import ij.process.FloatProcessor;
import javafx.application.Platform;
import javafx.concurrent.Task;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.control.*;
import javafx.scene.layout.*;
import javafx.scene.text.Font;
import javafx.scene.text.FontWeight;
import javafx.stage.DirectoryChooser;
import java.io.File;
import java.util.ArrayList;
import java.util.List;

public class StackingTab {

    private final FitsImageService fitsService = new FitsImageService();

    private Task<ReductionResult> currentTask;

    private TextField txtInput;
    private CheckBox chkPlateSolve;
    private Label valFrames, valFwhm, valSources, valSelected, valBackground;
    private TextArea logArea;
    private ProgressBar progressBar;
    private Button btnStart, btnStop;

    public Tab create() {
        Tab tab = new Tab("🌌 Stacking");
        BorderPane root = new BorderPane();
        root.setPadding(new Insets(15));

        HBox folderBox = new HBox(10);
        folderBox.setAlignment(Pos.CENTER_LEFT);
        txtInput = new TextField(AppConfig.getLastDirectory());
        txtInput.setPromptText("Folder of FITS frames...");
        txtInput.setPrefWidth(350);
        Button btnBrowse = new Button("📂 Select");
        btnBrowse.setOnAction(e -> browseDir(txtInput));
        folderBox.getChildren().addAll(new Label("FITS folder:"), txtInput, btnBrowse);

        chkPlateSolve = new CheckBox("🗺️ Plate-solve the combined image (ASTAP)");

        GridPane statsGrid = new GridPane();
        statsGrid.setHgap(20); statsGrid.setVgap(15);
        statsGrid.setPadding(new Insets(15));
        statsGrid.setStyle("-fx-border-color: #DDD; -fx-border-radius: 8; -fx-background-color: #FAFAFA;");
        statsGrid.setAlignment(Pos.CENTER);
        valFrames = createStatCard(statsGrid, "Frames", 0, 0);
        valFwhm = createStatCard(statsGrid, "FWHM (px)", 1, 0);
        valBackground = createStatCard(statsGrid, "Background (ADU)", 2, 0);
        valSources = createStatCard(statsGrid, "Sources", 0, 1);
        valSelected = createStatCard(statsGrid, "PSF stars", 1, 1);

        logArea = new TextArea();
        logArea.setEditable(false);
        logArea.setStyle("-fx-font-family: 'monospaced'; -fx-font-size: 11px;");

        btnStart = new Button("🚀 STACK");
        btnStart.setStyle("-fx-base: #4CAF50; -fx-text-fill: white; -fx-font-weight: bold; -fx-font-size: 14px;");
        btnStart.setMaxWidth(Double.MAX_VALUE);
        btnStart.setOnAction(e -> startStacking());

        btnStop = new Button("🛑 STOP");
        btnStop.setStyle("-fx-base: #F44336; -fx-text-fill: white; -fx-font-weight: bold;");
        btnStop.setDisable(true);
        btnStop.setOnAction(e -> { if (currentTask != null) currentTask.cancel(); });

        progressBar = new ProgressBar(0);
        progressBar.setMaxWidth(Double.MAX_VALUE);

        Label title = new Label("Register & Stack");
        title.setFont(Font.font("System", FontWeight.BOLD, 18));

        root.setTop(new VBox(10, title, folderBox, chkPlateSolve, statsGrid));
        root.setCenter(logArea);
        root.setBottom(new VBox(5, new HBox(10, btnStart, btnStop), progressBar));
        BorderPane.setMargin(logArea, new Insets(10, 0, 10, 0));

        tab.setContent(root);
        return tab;
    }

    private Label createStatCard(GridPane grid, String title, int col, int row) {
        VBox box = new VBox(5, new Label(title), new Label("--"));
        box.setAlignment(Pos.CENTER); box.setPrefWidth(120);
        ((Label)box.getChildren().get(0)).setStyle("-fx-text-fill: #666; -fx-font-size: 10px;");
        ((Label)box.getChildren().get(1)).setFont(Font.font("System", FontWeight.BOLD, 16));
        grid.add(box, col, row);
        return (Label)box.getChildren().get(1);
    }

    private void browseDir(TextField tf) {
        DirectoryChooser dc = new DirectoryChooser();
        File f = dc.showDialog(tf.getScene().getWindow());
        if (f != null) {
            tf.setText(f.getAbsolutePath());
            AppConfig.setLastDirectory(f.getAbsolutePath());
        }
    }

    private void log(String msg) {
        Platform.runLater(() -> logArea.appendText(msg + "\n"));
    }

    private void startStacking() {
        String path = txtInput.getText();
        if (path == null || path.isEmpty()) { logArea.appendText("⚠️ Select a folder.\n"); return; }
        File dir = new File(path);
        File[] files = fitsService.listFrames(dir);
        if (files.length == 0) { logArea.appendText("⚠️ No FITS files found.\n"); return; }

        final boolean plateSolve = chkPlateSolve.isSelected();
        final PipelineSettings settings = PipelineSettings.fromPreferences();
        logArea.clear();
        valFrames.setText(String.valueOf(files.length));

        currentTask = new Task<>() {
            @Override protected ReductionResult call() throws Exception {
                List<FloatProcessor> frames = new ArrayList<>();
                int count = 0;
                for (File f : files) {
                    if (isCancelled()) return null;
                    FrameData frame = fitsService.read(f);
                    if (!frames.isEmpty() && (frame.metadata.width != frames.get(0).getWidth()
                            || frame.metadata.height != frames.get(0).getHeight())) {
                        log("⚠️ Skipped " + f.getName() + ": size differs from the reference frame");
                        continue;
                    }
                    frames.add(frame.image);
                    updateProgress(++count, files.length + 1);
                }
                log("📥 Loaded " + frames.size() + " frames. Reference: " + files[0].getName());

                ReductionResult res = new ReductionPipeline(settings).reduce(frames);
                updateProgress(files.length + 1, files.length + 1);
                if (res.status != ReductionResult.Status.COMPLETE) return res;

                File combinedFile = new File(dir, "combined.fits");
                fitsService.write(combinedFile, res.combined, frames.size());
                fitsService.write(new File(dir, "flattened.fits"), res.flattened, frames.size());
                log("💾 Wrote combined.fits and flattened.fits");

                if (plateSolve) {
                    AstapPlateSolver solver = new AstapPlateSolver(AppConfig.getAstapPath(), AppConfig.getAstapDbPath(), 60);
                    CelestialPoint cp = solver.solve(combinedFile);
                    if (cp != null) log(String.format("🗺️ Field centre: RA %.5f / DEC %.5f", cp.ra(), cp.dec()));
                    else log("❌ Plate solve failed.");
                }
                return res;
            }
        };

        progressBar.progressProperty().bind(currentTask.progressProperty());
        btnStart.setDisable(true); btnStop.setDisable(false);

        currentTask.setOnSucceeded(e -> {
            showResult(currentTask.getValue());
            btnStart.setDisable(false); btnStop.setDisable(true);
        });
        currentTask.setOnFailed(e -> {
            Throwable ex = currentTask.getException();
            logArea.appendText("❌ Error: " + (ex != null ? ex.getMessage() : "unknown") + "\n");
            btnStart.setDisable(false); btnStop.setDisable(true);
        });
        currentTask.setOnCancelled(e -> {
            logArea.appendText("🛑 Cancelled.\n");
            btnStart.setDisable(false); btnStop.setDisable(true);
        });
        new Thread(currentTask).start();
    }

    private void showResult(ReductionResult res) {
        if (res == null) return;
        switch (res.status) {
            case NO_FWHM:
                logArea.appendText("❌ No unsaturated star could be fitted on the reference frame.\n");
                valFwhm.setText("0");
                return;
            case NO_DETECTION:
                logArea.appendText("❌ No stars detected on the reference frame.\n");
                valFwhm.setText(String.format("%.2f", res.fwhm.fwhm()));
                return;
            default:
                break;
        }
        valFwhm.setText(String.format("%.2f", res.fwhm.fwhm()));
        valBackground.setText(String.format("%.0f", res.background.median()));
        valSources.setText(String.valueOf(res.sources.size()));
        valSelected.setText(String.valueOf(res.selectedStars.size()));
        logArea.appendText(String.format("✅ Done. FWHM %.2f px | %d sources | %d PSF stars%n",
                res.fwhm.fwhm(), res.sources.size(), res.selectedStars.size()));
    }
}

package com.ttennebkram.imagelab.fx;

import com.ttennebkram.imagelab.capture.CameraFrameSource;
import com.ttennebkram.imagelab.capture.CaptureLoop;
import com.ttennebkram.imagelab.config.ImageLabConfig;
import com.ttennebkram.imagelab.errors.ImageLabException;
import com.ttennebkram.imagelab.export.EncodedImage;
import com.ttennebkram.imagelab.export.ExportFormat;
import com.ttennebkram.imagelab.export.Exporter;
import com.ttennebkram.imagelab.export.FileExportSink;
import com.ttennebkram.imagelab.model.ImageBuffer;
import com.ttennebkram.imagelab.model.SourceInfo;
import com.ttennebkram.imagelab.processing.AppliedOperation;
import com.ttennebkram.imagelab.processing.ChainMode;
import com.ttennebkram.imagelab.processing.Comparisons;
import com.ttennebkram.imagelab.processing.ImageStore;
import com.ttennebkram.imagelab.processing.InfoReporter;
import com.ttennebkram.imagelab.processing.OperationDispatcher;
import com.ttennebkram.imagelab.registry.Category;
import com.ttennebkram.imagelab.registry.OperationCatalog;
import com.ttennebkram.imagelab.registry.OperationParams;
import com.ttennebkram.imagelab.registry.OperationSpec;
import com.ttennebkram.imagelab.serialization.RecipeSerializer;
import javafx.application.Application;
import javafx.application.Platform;
import javafx.scene.Scene;
import javafx.scene.control.Button;
import javafx.scene.control.CheckBox;
import javafx.scene.control.ComboBox;
import javafx.scene.control.Label;
import javafx.scene.control.ListCell;
import javafx.scene.control.ScrollPane;
import javafx.scene.control.Separator;
import javafx.scene.control.ToggleButton;
import javafx.scene.control.ToolBar;
import javafx.scene.image.ImageView;
import javafx.scene.layout.BorderPane;
import javafx.scene.layout.HBox;
import javafx.stage.FileChooser;
import javafx.stage.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Single-window image lab: load an image, pick an operation, tune its parameters
 * and compare the result with the original.
 */
public class ImageLabApp extends Application {

    private static final Logger logger = LoggerFactory.getLogger(ImageLabApp.class);

    private static final String VIEW_SIDE_BY_SIDE = "Side by side";
    private static final String VIEW_HALF_SPLIT = "Half split";
    private static final String VIEW_PROCESSED = "Processed only";

    private Stage primaryStage;
    private ImageLabConfig config;
    private ImageStore store;
    private Exporter exporter;
    private InfoReporter infoReporter;

    private final ComboBox<Category> categoryCombo = new ComboBox<>();
    private final ComboBox<OperationSpec> operationCombo = new ComboBox<>();
    private final ComboBox<String> viewCombo = new ComboBox<>();
    private final CheckBox chainCheckBox = new CheckBox("Chain results");
    private final ToggleButton webcamButton = new ToggleButton("Webcam");
    private final FXParameterPanel parameterPanel = new FXParameterPanel();
    private final ImageView imageView = new ImageView();
    private final Label statusLabel = new Label("Open an image to start");

    // True while parameter changes should replace the last chained step instead of adding one
    private boolean editingLastStep = false;
    private CaptureLoop captureLoop;

    @Override
    public void start(Stage primaryStage) throws IOException {
        this.primaryStage = primaryStage;
        config = ImageLabConfig.load();

        OperationCatalog catalog = OperationCatalog.createDefault();
        store = new ImageStore(new OperationDispatcher(catalog), config.getChainMode());
        exporter = new Exporter(new FileExportSink(config.getExportDirectory()));
        infoReporter = new InfoReporter(exporter, config.getJpegQuality());

        BorderPane root = new BorderPane();
        root.setTop(createToolBar(catalog));

        ScrollPane paramScroll = new ScrollPane(parameterPanel);
        paramScroll.setFitToWidth(true);
        root.setLeft(paramScroll);

        imageView.setPreserveRatio(true);
        imageView.fitWidthProperty().bind(primaryStage.widthProperty().subtract(360));
        imageView.fitHeightProperty().bind(primaryStage.heightProperty().subtract(140));
        root.setCenter(new ScrollPane(imageView));

        HBox statusBar = new HBox(statusLabel);
        statusBar.setStyle("-fx-padding: 4 8 4 8; -fx-background-color: #eeeeee;");
        root.setBottom(statusBar);

        parameterPanel.setOnChange(this::onParametersChanged);

        primaryStage.setTitle("OpenCV Image Lab");
        primaryStage.setScene(new Scene(root, 1280, 800));
        primaryStage.setOnCloseRequest(e -> stopWebcam());
        primaryStage.show();

        categoryCombo.getSelectionModel().selectFirst();

        // Optional image path on the command line
        List<String> args = getParameters().getUnnamed();
        if (!args.isEmpty()) {
            loadFile(new File(args.get(0)), false);
        }
    }

    private ToolBar createToolBar(OperationCatalog catalog) {
        Button openButton = new Button("Open...");
        openButton.setOnAction(e -> openImage(false));
        Button openSecondButton = new Button("Second Image...");
        openSecondButton.setOnAction(e -> openImage(true));

        categoryCombo.getItems().addAll(catalog.categories());
        categoryCombo.valueProperty().addListener((obs, oldVal, newVal) -> {
            operationCombo.getItems().setAll(catalog.listByCategory(newVal));
            operationCombo.getSelectionModel().selectFirst();
        });

        operationCombo.setCellFactory(list -> new OperationCell());
        operationCombo.setButtonCell(new OperationCell());
        operationCombo.valueProperty().addListener((obs, oldVal, newVal) -> {
            parameterPanel.showOperation(newVal);
            editingLastStep = false;
            applySelected(parameterPanel.getValues());
        });

        chainCheckBox.setSelected(store.getChainMode() == ChainMode.APPLY_TO_PROCESSED);
        chainCheckBox.selectedProperty().addListener((obs, oldVal, newVal) -> {
            store.setChainMode(newVal ? ChainMode.APPLY_TO_PROCESSED : ChainMode.APPLY_TO_ORIGINAL);
            editingLastStep = false;
        });
        Button applyButton = new Button("Apply");
        applyButton.setOnAction(e -> {
            editingLastStep = false;
            applySelected(parameterPanel.getValues());
        });

        Button resetButton = new Button("Reset");
        resetButton.setOnAction(e -> {
            store.reset();
            editingLastStep = false;
            refreshView();
        });

        viewCombo.getItems().addAll(VIEW_SIDE_BY_SIDE, VIEW_HALF_SPLIT, VIEW_PROCESSED);
        viewCombo.setValue(VIEW_SIDE_BY_SIDE);
        viewCombo.valueProperty().addListener((obs, oldVal, newVal) -> refreshView());

        Button saveButton = new Button("Save As...");
        saveButton.setOnAction(e -> saveImage());
        Button saveRecipeButton = new Button("Save Recipe...");
        saveRecipeButton.setOnAction(e -> saveRecipe());
        Button loadRecipeButton = new Button("Load Recipe...");
        loadRecipeButton.setOnAction(e -> loadRecipe());

        webcamButton.selectedProperty().addListener((obs, oldVal, newVal) -> {
            if (newVal) {
                startWebcam();
            } else {
                stopWebcam();
            }
        });

        return new ToolBar(openButton, openSecondButton, new Separator(),
                categoryCombo, operationCombo, chainCheckBox, applyButton, resetButton, new Separator(),
                viewCombo, new Separator(),
                saveButton, saveRecipeButton, loadRecipeButton, new Separator(), webcamButton);
    }

    private void onParametersChanged(Map<String, Object> values) {
        applySelected(values);
    }

    /**
     * Recompute with the selected operation. In chain mode, repeated parameter edits
     * replace the step they created rather than stacking new ones.
     */
    private void applySelected(Map<String, Object> values) {
        OperationSpec spec = operationCombo.getValue();
        if (spec == null || store.getState() == ImageStore.State.EMPTY) {
            return;
        }
        try {
            if (spec.isDualInput() && store.getSecondOperand() == null) {
                setStatus(spec.getDisplayName() + " needs a second image");
                return;
            }
            if (editingLastStep && store.getChainMode() == ChainMode.APPLY_TO_PROCESSED) {
                List<AppliedOperation> steps = new ArrayList<>(store.getHistory());
                if (!steps.isEmpty()) {
                    steps.remove(steps.size() - 1);
                }
                steps.add(new AppliedOperation(spec, OperationParams.resolve(spec, values)));
                store.replay(steps);
            } else {
                store.applyOperation(spec, values);
            }
            editingLastStep = true;
            refreshView();
        } catch (ImageLabException e) {
            logger.warn("{} failed: {}", spec.getKey(), e.getMessage());
            setStatus("Error: " + e.getMessage());
        }
    }

    private void refreshView() {
        ImageBuffer original = store.getOriginal();
        if (original == null) {
            imageView.setImage(null);
            return;
        }
        ImageBuffer processed = store.getProcessed();
        ImageBuffer shown;
        if (processed == null) {
            shown = original;
        } else if (VIEW_HALF_SPLIT.equals(viewCombo.getValue())) {
            shown = Comparisons.halfSplit(original, processed);
        } else if (VIEW_PROCESSED.equals(viewCombo.getValue())) {
            shown = processed;
        } else {
            shown = Comparisons.sideBySide(original, processed);
        }
        imageView.setImage(FXImageUtils.toImage(shown));

        String status = infoReporter.statusLine(original, store.getSourceInfo());
        if (processed != null) {
            status += "  |  Result: " + infoReporter.statusLine(processed, null) + ", " + processed.getPixelFormat()
                    + ", " + store.getHistory().size() + " step(s)";
        }
        setStatus(status);
    }

    private void openImage(boolean second) {
        FileChooser chooser = new FileChooser();
        chooser.setTitle(second ? "Open Second Image" : "Open Image");
        List<String> patterns = new ArrayList<>();
        for (String ext : config.getAllowedExtensions()) {
            patterns.add("*." + ext);
        }
        chooser.getExtensionFilters().add(new FileChooser.ExtensionFilter("Images", patterns));
        File file = chooser.showOpenDialog(primaryStage);
        if (file != null) {
            loadFile(file, second);
        }
    }

    private void loadFile(File file, boolean second) {
        if (!config.isAllowedFile(file.getName())) {
            setStatus("Unsupported file type: " + file.getName());
            return;
        }
        try {
            byte[] bytes = Files.readAllBytes(file.toPath());
            if (second) {
                store.loadSecondOperand(bytes);
                setStatus("Second image: " + file.getName());
            } else {
                store.load(bytes, SourceInfo.forFile(file.getName(), bytes.length));
            }
            editingLastStep = false;
            applySelected(parameterPanel.getValues());
            refreshView();
        } catch (IOException e) {
            logger.error("Cannot read {}", file, e);
            setStatus("Cannot read " + file.getName() + ": " + e.getMessage());
        } catch (ImageLabException e) {
            logger.warn("Cannot open {}: {}", file, e.getMessage());
            setStatus("Error: " + e.getMessage());
        }
    }

    private void saveImage() {
        ImageBuffer current = store.getCurrent();
        if (current == null) {
            setStatus("Nothing to save");
            return;
        }
        FileChooser chooser = new FileChooser();
        chooser.setTitle("Save Image");
        for (ExportFormat format : ExportFormat.values()) {
            chooser.getExtensionFilters().add(
                    new FileChooser.ExtensionFilter(format.name(), "*" + format.getExtension()));
        }
        ExportFormat defaultFormat = config.getDefaultExportFormat();
        chooser.setSelectedExtensionFilter(chooser.getExtensionFilters().get(defaultFormat.ordinal()));
        File file = chooser.showSaveDialog(primaryStage);
        if (file == null) {
            return;
        }
        ExportFormat format = ExportFormat.fromName(
                chooser.getSelectedExtensionFilter() == null ? defaultFormat.name()
                        : chooser.getSelectedExtensionFilter().getDescription());
        try {
            EncodedImage encoded = exporter.encode(current, format,
                    format.isLossy() ? config.getJpegQuality() : null);
            Exporter fileExporter = new Exporter(new FileExportSink(file.getParentFile().toPath()));
            String written = fileExporter.toDownload(encoded, file.getName());
            setStatus("Saved " + written + " (" + InfoReporter.kilobytes(encoded.length()) + ")");
        } catch (IOException e) {
            logger.error("Cannot save {}", file, e);
            setStatus("Cannot save: " + e.getMessage());
        } catch (ImageLabException e) {
            setStatus("Error: " + e.getMessage());
        }
    }

    private void saveRecipe() {
        FileChooser chooser = new FileChooser();
        chooser.setTitle("Save Recipe");
        chooser.getExtensionFilters().add(new FileChooser.ExtensionFilter("Recipe", "*.json"));
        File file = chooser.showSaveDialog(primaryStage);
        if (file == null) {
            return;
        }
        try {
            RecipeSerializer.save(file.toPath(), store.getHistory(), store.getChainMode());
            setStatus("Recipe saved to " + file.getName());
        } catch (IOException e) {
            logger.error("Cannot save recipe {}", file, e);
            setStatus("Cannot save recipe: " + e.getMessage());
        }
    }

    private void loadRecipe() {
        FileChooser chooser = new FileChooser();
        chooser.setTitle("Load Recipe");
        chooser.getExtensionFilters().add(new FileChooser.ExtensionFilter("Recipe", "*.json"));
        File file = chooser.showOpenDialog(primaryStage);
        if (file == null) {
            return;
        }
        try {
            RecipeSerializer.Recipe recipe = RecipeSerializer.load(file.toPath(),
                    store.getDispatcher().getCatalog());
            chainCheckBox.setSelected(recipe.chainMode == ChainMode.APPLY_TO_PROCESSED);
            store.replay(recipe.steps);
            editingLastStep = false;
            refreshView();
        } catch (IOException e) {
            logger.error("Cannot load recipe {}", file, e);
            setStatus("Cannot load recipe: " + e.getMessage());
        } catch (ImageLabException e) {
            setStatus("Error: " + e.getMessage());
        }
    }

    private void startWebcam() {
        try {
            CameraFrameSource source = CameraFrameSource.open(config.getCamera());
            captureLoop = new CaptureLoop(source, frame -> Platform.runLater(() -> onFrame(frame)),
                    config.getCamera().getFps());
            captureLoop.start();
            setStatus("Webcam running");
        } catch (IOException e) {
            logger.warn("Webcam unavailable: {}", e.getMessage());
            setStatus(e.getMessage());
            webcamButton.setSelected(false);
        }
    }

    private void onFrame(ImageBuffer frame) {
        if (captureLoop == null) {
            return;
        }
        store.load(frame, null);
        editingLastStep = false;
        applySelected(parameterPanel.getValues());
        refreshView();
    }

    private void stopWebcam() {
        if (captureLoop != null) {
            captureLoop.stop(1000);
            captureLoop = null;
            setStatus("Webcam stopped");
        }
    }

    private void setStatus(String text) {
        statusLabel.setText(text);
    }

    private static class OperationCell extends ListCell<OperationSpec> {
        @Override
        protected void updateItem(OperationSpec item, boolean empty) {
            super.updateItem(item, empty);
            setText(empty || item == null ? null : item.getDisplayName());
        }
    }
}

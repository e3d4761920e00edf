package com.astrostack.main;

import com.astrostack.ui.SettingsTab;
import com.astrostack.ui.StackingTab;
import javafx.application.Application;
import javafx.scene.Scene;
import javafx.scene.control.TabPane;
import javafx.stage.Stage;

public class AstroStackApp extends Application {

    @Override
    public void start(Stage primaryStage) {
        primaryStage.setTitle("🔭 AstroStack");

        TabPane tabPane = new TabPane();
        tabPane.getTabs().add(new StackingTab().create());
        tabPane.getTabs().add(new SettingsTab().create());

        Scene scene = new Scene(tabPane, 900, 750);
        primaryStage.setScene(scene);
        primaryStage.show();
    }

    public static void main(String[] args) {
        launch(args);
    }
}

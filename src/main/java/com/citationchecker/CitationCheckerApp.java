package com.citationchecker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.*;
import javax.swing.event.UndoableEditEvent;
import javax.swing.filechooser.FileNameExtensionFilter;
import javax.swing.text.DefaultEditorKit;
import javax.swing.undo.CannotRedoException;
import javax.swing.undo.CannotUndoException;
import javax.swing.undo.UndoManager;
import java.awt.*;
import java.awt.datatransfer.DataFlavor;
import java.awt.datatransfer.StringSelection;
import java.awt.dnd.DnDConstants;
import java.awt.dnd.DropTarget;
import java.awt.dnd.DropTargetDropEvent;
import java.awt.event.KeyEvent;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.prefs.Preferences;

/**
 * Swing front end for the citation checker.
 * <p>
 * Features:
 * <ul>
 *   <li>Paste a manuscript or open / drag-and-drop a .txt, .md or .pdf file</li>
 *   <li>Check name-year citations (APA, Vancouver, Chicago or auto-detected)</li>
 *   <li>Renumber numeric citations in order of first appearance</li>
 *   <li>Copy or save the report, recent files, keyboard shortcuts</li>
 * </ul>
 * Started with arguments, the program runs {@link CheckCommand} instead.
 */
public class CitationCheckerApp {

    private static final Logger log = LoggerFactory.getLogger(CitationCheckerApp.class);

    private static final String APP_TITLE = "Citation Checker";
    private static final int WINDOW_WIDTH = 950;
    private static final int WINDOW_HEIGHT = 800;
    private static final int TEXT_AREA_ROWS = 18;
    private static final int TEXT_AREA_COLS = 70;

    private static final String[] STYLE_CHOICES = {"Auto-detect", "APA", "Vancouver", "Chicago", "Numeric"};
    private static final int STYLE_AUTO = 0;
    private static final int STYLE_NUMERIC = 4;

    // Preferences keys
    private static final String PREF_STYLE = "citationStyle";
    private static final String PREF_RECENT_FILES = "recentFiles";
    private static final String PREF_LAST_DIR = "lastDirectory";
    private static final int MAX_RECENT_FILES = 5;

    private final Preferences prefs = Preferences.userNodeForPackage(CitationCheckerApp.class);

    private JFrame frame;
    private JTextArea inputArea;
    private JTextArea outputArea;
    private JLabel statusLabel;
    private JProgressBar progressBar;
    private JComboBox<String> styleCombo;

    private JButton openButton;
    private JButton checkButton;
    private JButton renumberButton;
    private JButton copyButton;
    private JButton saveButton;
    private JButton clearButton;

    private JMenu recentFilesMenu;
    private final List<Path> recentFiles = new ArrayList<>();

    private final UndoManager inputUndo = new UndoManager();

    private String documentName = "Pasted text";
    private SwingWorker<?, ?> currentWorker;

    public static void main(String[] args) {
        if (args.length > 0) {
            System.exit(CheckCommand.commandLine().execute(args));
        }

        try {
            UIManager.setLookAndFeel(UIManager.getSystemLookAndFeelClassName());
        } catch (Exception e) {
            log.debug("System look and feel unavailable: {}", e.getMessage());
        }

        System.setProperty("awt.useSystemAAFontSettings", "on");
        System.setProperty("swing.aatext", "true");

        SwingUtilities.invokeLater(() -> new CitationCheckerApp().createAndShowGUI());
    }

    private void createAndShowGUI() {
        loadPreferences();

        frame = new JFrame(APP_TITLE);
        frame.setDefaultCloseOperation(JFrame.EXIT_ON_CLOSE);
        frame.setSize(WINDOW_WIDTH, WINDOW_HEIGHT);
        frame.setMinimumSize(new Dimension(600, 500));

        frame.add(createMainPanel());
        // styleCombo must exist before the menu bar
        frame.setJMenuBar(createMenuBar());
        frame.setLocationRelativeTo(null);

        frame.addWindowListener(new java.awt.event.WindowAdapter() {
            @Override
            public void windowClosing(java.awt.event.WindowEvent e) {
                savePreferences();
            }
        });

        frame.setVisible(true);
    }

    private JPanel createMainPanel() {
        JPanel panel = new JPanel(new BorderLayout(10, 10));
        panel.setBorder(BorderFactory.createEmptyBorder(10, 10, 10, 10));

        JPanel statusPanel = new JPanel(new BorderLayout(5, 0));
        statusLabel = new JLabel("Ready");
        statusLabel.setBorder(BorderFactory.createEmptyBorder(0, 5, 0, 5));
        statusLabel.setForeground(Color.GRAY);

        progressBar = new JProgressBar();
        progressBar.setIndeterminate(true);
        progressBar.setVisible(false);
        progressBar.setPreferredSize(new Dimension(100, 16));

        statusPanel.add(statusLabel, BorderLayout.CENTER);
        statusPanel.add(progressBar, BorderLayout.EAST);

        JPanel controlPanel = new JPanel(new BorderLayout());
        controlPanel.add(createButtonPanel(), BorderLayout.CENTER);
        controlPanel.add(statusPanel, BorderLayout.SOUTH);

        JSplitPane splitPane = new JSplitPane(JSplitPane.VERTICAL_SPLIT, createInputPanel(), createOutputPanel());
        splitPane.setResizeWeight(0.5);
        splitPane.setOneTouchExpandable(true);

        panel.add(splitPane, BorderLayout.CENTER);
        panel.add(controlPanel, BorderLayout.SOUTH);
        return panel;
    }

    private JPanel createInputPanel() {
        JPanel panel = new JPanel(new BorderLayout(5, 5));

        JLabel label = new JLabel("Paste a manuscript (bibliography between <ref-open> and <ref-close> or under a References heading), or drop a .txt/.md/.pdf file:");
        label.setFont(label.getFont().deriveFont(Font.BOLD));

        inputArea = new JTextArea(TEXT_AREA_ROWS, TEXT_AREA_COLS);
        inputArea.setFont(new Font(Font.MONOSPACED, Font.PLAIN, 12));
        inputArea.setLineWrap(true);
        inputArea.setWrapStyleWord(true);
        inputArea.getDocument().addUndoableEditListener((UndoableEditEvent e) -> inputUndo.addEdit(e.getEdit()));

        inputArea.setDropTarget(new DropTarget() {
            @SuppressWarnings("unchecked")
            public synchronized void drop(DropTargetDropEvent evt) {
                try {
                    evt.acceptDrop(DnDConstants.ACTION_COPY);
                    List<File> droppedFiles = (List<File>)
                            evt.getTransferable().getTransferData(DataFlavor.javaFileListFlavor);

                    if (droppedFiles.isEmpty()) {
                        setStatus("No file dropped.", true);
                        return;
                    }
                    Path path = droppedFiles.get(0).toPath();
                    addToRecentFiles(path);
                    loadFromFileAsync(path);
                } catch (Exception ex) {
                    log.warn("Drop failed", ex);
                    setStatus("Error dropping file: " + ex.getMessage(), true);
                }
            }
        });

        JScrollPane scrollPane = new JScrollPane(inputArea);
        scrollPane.setVerticalScrollBarPolicy(JScrollPane.VERTICAL_SCROLLBAR_ALWAYS);

        panel.add(label, BorderLayout.NORTH);
        panel.add(scrollPane, BorderLayout.CENTER);
        return panel;
    }

    private JPanel createOutputPanel() {
        JPanel panel = new JPanel(new BorderLayout(5, 5));

        JLabel label = new JLabel("Report:");
        label.setFont(label.getFont().deriveFont(Font.BOLD));

        outputArea = new JTextArea(TEXT_AREA_ROWS, TEXT_AREA_COLS);
        outputArea.setFont(new Font(Font.MONOSPACED, Font.PLAIN, 12));
        outputArea.setEditable(false);
        outputArea.setBackground(new Color(245, 245, 245));

        JScrollPane scrollPane = new JScrollPane(outputArea);
        scrollPane.setVerticalScrollBarPolicy(JScrollPane.VERTICAL_SCROLLBAR_ALWAYS);

        panel.add(label, BorderLayout.NORTH);
        panel.add(scrollPane, BorderLayout.CENTER);
        return panel;
    }

    private JPanel createButtonPanel() {
        JPanel panel = new JPanel(new FlowLayout(FlowLayout.CENTER, 8, 10));

        openButton = new JButton("Open File");
        checkButton = new JButton("Check");
        renumberButton = new JButton("Renumber");
        copyButton = new JButton("Copy Report");
        saveButton = new JButton("Save Report");
        clearButton = new JButton("Clear");

        styleCombo = new JComboBox<>(STYLE_CHOICES);
        styleCombo.setToolTipText("Citation style of the manuscript");
        int savedStyle = prefs.getInt(PREF_STYLE, STYLE_AUTO);
        styleCombo.setSelectedIndex(savedStyle >= 0 && savedStyle < STYLE_CHOICES.length ? savedStyle : STYLE_AUTO);

        renumberButton.setToolTipText("Renumber numeric citations and the bibliography in order of first appearance");

        Dimension btnSize = new Dimension(110, 30);
        openButton.setPreferredSize(btnSize);
        checkButton.setPreferredSize(btnSize);
        renumberButton.setPreferredSize(btnSize);
        copyButton.setPreferredSize(btnSize);
        saveButton.setPreferredSize(btnSize);
        clearButton.setPreferredSize(new Dimension(80, 30));

        openButton.addActionListener(e -> openFile());
        checkButton.addActionListener(e -> checkAsync());
        renumberButton.addActionListener(e -> renumberAsync());
        copyButton.addActionListener(e -> copyToClipboard());
        saveButton.addActionListener(e -> saveReportToFile());
        clearButton.addActionListener(e -> clearAll());

        panel.add(openButton);
        panel.add(new JLabel("Style:"));
        panel.add(styleCombo);
        panel.add(checkButton);
        panel.add(renumberButton);
        panel.add(copyButton);
        panel.add(saveButton);
        panel.add(clearButton);
        return panel;
    }

    private JMenuBar createMenuBar() {
        JMenuBar menuBar = new JMenuBar();
        int menuMask = Toolkit.getDefaultToolkit().getMenuShortcutKeyMaskEx();

        JMenu file = new JMenu("File");
        file.setMnemonic(KeyEvent.VK_F);

        JMenuItem openItem = new JMenuItem("Open…");
        openItem.setAccelerator(KeyStroke.getKeyStroke(KeyEvent.VK_O, menuMask));
        openItem.addActionListener(e -> openFile());
        file.add(openItem);

        recentFilesMenu = new JMenu("Open Recent");
        updateRecentFilesMenu();
        file.add(recentFilesMenu);

        file.addSeparator();

        JMenuItem saveItem = new JMenuItem("Save Report…");
        saveItem.setAccelerator(KeyStroke.getKeyStroke(KeyEvent.VK_S, menuMask));
        saveItem.addActionListener(e -> saveReportToFile());
        file.add(saveItem);

        file.addSeparator();

        JMenuItem exitItem = new JMenuItem("Exit");
        exitItem.setAccelerator(KeyStroke.getKeyStroke(KeyEvent.VK_Q, menuMask));
        exitItem.addActionListener(e -> {
            savePreferences();
            frame.dispose();
        });
        file.add(exitItem);

        JMenu edit = new JMenu("Edit");
        edit.setMnemonic(KeyEvent.VK_E);

        JMenuItem cutItem = new JMenuItem(new DefaultEditorKit.CutAction());
        cutItem.setText("Cut");
        cutItem.setAccelerator(KeyStroke.getKeyStroke(KeyEvent.VK_X, menuMask));
        edit.add(cutItem);

        JMenuItem copyItem = new JMenuItem(new DefaultEditorKit.CopyAction());
        copyItem.setText("Copy");
        copyItem.setAccelerator(KeyStroke.getKeyStroke(KeyEvent.VK_C, menuMask));
        edit.add(copyItem);

        JMenuItem pasteItem = new JMenuItem(new DefaultEditorKit.PasteAction());
        pasteItem.setText("Paste");
        pasteItem.setAccelerator(KeyStroke.getKeyStroke(KeyEvent.VK_V, menuMask));
        edit.add(pasteItem);

        edit.addSeparator();

        JMenuItem undoItem = new JMenuItem("Undo");
        undoItem.setAccelerator(KeyStroke.getKeyStroke(KeyEvent.VK_Z, menuMask));
        undoItem.addActionListener(e -> undo());
        edit.add(undoItem);

        JMenuItem redoItem = new JMenuItem("Redo");
        redoItem.setAccelerator(KeyStroke.getKeyStroke(KeyEvent.VK_Z, menuMask | java.awt.event.InputEvent.SHIFT_DOWN_MASK));
        redoItem.addActionListener(e -> redo());
        edit.add(redoItem);

        JMenu actions = new JMenu("Actions");
        actions.setMnemonic(KeyEvent.VK_A);

        JMenuItem checkItem = new JMenuItem("Check Citations");
        checkItem.setAccelerator(KeyStroke.getKeyStroke(KeyEvent.VK_ENTER, menuMask));
        checkItem.addActionListener(e -> checkAsync());
        actions.add(checkItem);

        JMenuItem renumberItem = new JMenuItem("Renumber");
        renumberItem.setAccelerator(KeyStroke.getKeyStroke(KeyEvent.VK_R, menuMask));
        renumberItem.addActionListener(e -> renumberAsync());
        actions.add(renumberItem);

        actions.addSeparator();

        JMenuItem copyReportItem = new JMenuItem("Copy Report");
        copyReportItem.setAccelerator(KeyStroke.getKeyStroke(KeyEvent.VK_C, menuMask | java.awt.event.InputEvent.SHIFT_DOWN_MASK));
        copyReportItem.addActionListener(e -> copyToClipboard());
        actions.add(copyReportItem);

        JMenuItem clearItem = new JMenuItem("Clear All");
        clearItem.setAccelerator(KeyStroke.getKeyStroke(KeyEvent.VK_L, menuMask));
        clearItem.addActionListener(e -> clearAll());
        actions.add(clearItem);

        JMenu help = new JMenu("Help");
        help.setMnemonic(KeyEvent.VK_H);

        JMenuItem aboutItem = new JMenuItem("About");
        aboutItem.addActionListener(e -> showAboutDialog());
        help.add(aboutItem);

        JMenuItem shortcutsItem = new JMenuItem("Keyboard Shortcuts");
        shortcutsItem.addActionListener(e -> showShortcutsDialog());
        help.add(shortcutsItem);

        menuBar.add(file);
        menuBar.add(edit);
        menuBar.add(actions);
        menuBar.add(help);
        return menuBar;
    }

    private void undo() {
        try {
            if (inputUndo.canUndo()) inputUndo.undo();
        } catch (CannotUndoException e) {
            log.debug("Nothing to undo: {}", e.getMessage());
        }
    }

    private void redo() {
        try {
            if (inputUndo.canRedo()) inputUndo.redo();
        } catch (CannotRedoException e) {
            log.debug("Nothing to redo: {}", e.getMessage());
        }
    }

    private void setBusy(boolean busy, String message) {
        openButton.setEnabled(!busy);
        checkButton.setEnabled(!busy);
        renumberButton.setEnabled(!busy);
        copyButton.setEnabled(!busy);
        saveButton.setEnabled(!busy);
        clearButton.setEnabled(!busy);
        styleCombo.setEnabled(!busy);
        inputArea.setEditable(!busy);
        progressBar.setVisible(busy);
        frame.setCursor(busy ? Cursor.getPredefinedCursor(Cursor.WAIT_CURSOR) : Cursor.getDefaultCursor());
        if (message != null) setStatus(message, false);
    }

    private boolean isBusy() {
        return currentWorker != null && !currentWorker.isDone();
    }

    /**
     * Current input as paragraphs, one per line, with the bibliography marked.
     */
    private List<String> inputParagraphs() {
        return ManuscriptReader.fromLines(Arrays.asList(inputArea.getText().split("\\R", -1)));
    }

    private void checkAsync() {
        if (isBusy()) return;
        if (inputArea.getText().isBlank()) {
            setStatus("Please paste or open a manuscript first.", true);
            return;
        }
        if (styleCombo.getSelectedIndex() == STYLE_NUMERIC) {
            renumberAsync();
            return;
        }

        List<String> texts = inputParagraphs();
        int styleIndex = styleCombo.getSelectedIndex();
        String name = documentName;
        setBusy(true, "Checking citations…");

        SwingWorker<ValidationResult, Void> worker = new SwingWorker<>() {
            @Override
            protected ValidationResult doInBackground() {
                List<Paragraph> paragraphs = Paragraph.of(texts);
                return styleIndex == STYLE_AUTO
                        ? CitationValidator.validate(paragraphs)
                        : CitationValidator.validate(paragraphs, selectedStyle(styleIndex));
            }

            @Override
            protected void done() {
                try {
                    ValidationResult result = get();
                    showReport(ValidationReport.render(result, name));
                    if (result.totalCitations() == 0 && result.totalReferences() == 0) {
                        setStatus("No citations or references found.", true);
                    } else {
                        setStatus("Done. " + result.totalCitations() + " citation(s), "
                                + result.totalReferences() + " reference(s), "
                                + result.commentCount() + " comment(s).", false);
                    }
                } catch (Exception ex) {
                    log.warn("Citation check failed", ex);
                    setStatus("Check failed: " + ex.getMessage(), true);
                } finally {
                    setBusy(false, null);
                    currentWorker = null;
                }
            }
        };
        currentWorker = worker;
        worker.execute();
    }

    private void renumberAsync() {
        if (isBusy()) return;
        if (inputArea.getText().isBlank()) {
            setStatus("Please paste or open a manuscript first.", true);
            return;
        }

        List<String> texts = inputParagraphs();
        String name = documentName;
        setBusy(true, "Renumbering citations…");

        SwingWorker<NumericSequencer.RenumberOutcome, Void> worker = new SwingWorker<>() {
            @Override
            protected NumericSequencer.RenumberOutcome doInBackground() {
                return NumericSequencer.renumber(NumberedDocument.fromPlainParagraphs(texts));
            }

            @Override
            protected void done() {
                try {
                    NumericSequencer.RenumberOutcome outcome = get();
                    showReport(ValidationReport.renderNumeric(outcome, name));
                    if (!outcome.plan().isEmpty()) {
                        // undoable through the input area's UndoManager
                        inputArea.setText(outcome.document().toPlainText());
                        inputArea.setCaretPosition(0);
                    }
                    setStatus(outcome.status(), outcome.aborted());
                } catch (Exception ex) {
                    log.warn("Renumbering failed", ex);
                    setStatus("Renumbering failed: " + ex.getMessage(), true);
                } finally {
                    setBusy(false, null);
                    currentWorker = null;
                }
            }
        };
        currentWorker = worker;
        worker.execute();
    }

    private static CitationStyle selectedStyle(int index) {
        return switch (index) {
            case 2 -> CitationStyle.VANCOUVER;
            case 3 -> CitationStyle.CHICAGO;
            default -> CitationStyle.APA;
        };
    }

    private void showReport(String report) {
        outputArea.setText(report);
        outputArea.setCaretPosition(0);
    }

    private void openFile() {
        JFileChooser fileChooser = new JFileChooser();
        fileChooser.setDialogTitle("Select a manuscript");
        fileChooser.setFileFilter(new FileNameExtensionFilter("Manuscripts (*.txt, *.md, *.pdf)", "txt", "md", "pdf"));

        String lastDir = prefs.get(PREF_LAST_DIR, null);
        if (lastDir != null) {
            fileChooser.setCurrentDirectory(new File(lastDir));
        }

        if (fileChooser.showOpenDialog(frame) == JFileChooser.APPROVE_OPTION) {
            Path path = fileChooser.getSelectedFile().toPath();
            if (path.getParent() != null) {
                prefs.put(PREF_LAST_DIR, path.getParent().toString());
            }
            addToRecentFiles(path);
            loadFromFileAsync(path);
        }
    }

    private void loadFromFileAsync(Path path) {
        if (!isManuscriptFile(path)) {
            setStatus("Please choose a .txt, .md or .pdf file.", true);
            return;
        }
        if (isBusy()) return;
        setBusy(true, "Loading " + path.getFileName() + "…");

        SwingWorker<List<String>, Void> worker = new SwingWorker<>() {
            @Override
            protected List<String> doInBackground() throws IOException {
                return ManuscriptReader.read(path);
            }

            @Override
            protected void done() {
                try {
                    List<String> paragraphs = get();
                    inputArea.setText(String.join("\n", paragraphs));
                    inputArea.setCaretPosition(0);
                    outputArea.setText("");
                    documentName = path.getFileName().toString();
                    setStatus("Loaded file: " + path.getFileName() + " (" + paragraphs.size() + " paragraphs)", false);
                } catch (Exception ex) {
                    log.warn("Could not load {}", path, ex);
                    showError("Error reading file: " + ex.getMessage());
                    setStatus("Failed to load file.", true);
                } finally {
                    setBusy(false, null);
                    currentWorker = null;
                }
            }
        };
        currentWorker = worker;
        worker.execute();
    }

    private static boolean isManuscriptFile(Path path) {
        String name = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".txt") || name.endsWith(".md") || name.endsWith(".pdf");
    }

    private void clearAll() {
        inputArea.setText("");
        outputArea.setText("");
        documentName = "Pasted text";
        setStatus("Cleared all text.", false);
        inputArea.requestFocus();
    }

    private void copyToClipboard() {
        String content = outputArea.getText();
        if (content == null || content.isBlank()) {
            setStatus("Report is empty. Nothing to copy.", true);
            return;
        }
        Toolkit.getDefaultToolkit().getSystemClipboard().setContents(new StringSelection(content), null);
        setStatus("Report copied to clipboard.", false);
    }

    private void setStatus(String message, boolean isError) {
        statusLabel.setText(message);
        statusLabel.setForeground(isError ? new Color(180, 0, 0) : new Color(50, 50, 50));
    }

    private void showError(String message) {
        JOptionPane.showMessageDialog(frame, message, "Error", JOptionPane.ERROR_MESSAGE);
    }

    private void saveReportToFile() {
        String content = outputArea.getText();
        if (content == null || content.isBlank()) {
            setStatus("Report is empty. Nothing to save.", true);
            return;
        }

        JFileChooser fileChooser = new JFileChooser();
        fileChooser.setDialogTitle("Save Report As");
        fileChooser.setFileFilter(new FileNameExtensionFilter("Text files (*.txt)", "txt"));
        fileChooser.setSelectedFile(new File("citation_report.txt"));
        String lastDir = prefs.get(PREF_LAST_DIR, null);
        if (lastDir != null) {
            fileChooser.setCurrentDirectory(new File(lastDir));
        }

        if (fileChooser.showSaveDialog(frame) == JFileChooser.APPROVE_OPTION) {
            Path path = fileChooser.getSelectedFile().toPath();
            if (!path.toString().toLowerCase(Locale.ROOT).endsWith(".txt")) {
                path = Path.of(path + ".txt");
            }
            try {
                Files.writeString(path, content, StandardCharsets.UTF_8);
                if (path.getParent() != null) {
                    prefs.put(PREF_LAST_DIR, path.getParent().toString());
                }
                setStatus("Saved to: " + path.getFileName(), false);
            } catch (IOException ex) {
                log.warn("Could not save report to {}", path, ex);
                showError("Error saving file: " + ex.getMessage());
            }
        }
    }

    private void addToRecentFiles(Path path) {
        recentFiles.remove(path);
        recentFiles.add(0, path);
        while (recentFiles.size() > MAX_RECENT_FILES) {
            recentFiles.remove(recentFiles.size() - 1);
        }
        updateRecentFilesMenu();
    }

    private void updateRecentFilesMenu() {
        if (recentFilesMenu == null) return;
        recentFilesMenu.removeAll();

        if (recentFiles.isEmpty()) {
            JMenuItem emptyItem = new JMenuItem("(No Recent Files)");
            emptyItem.setEnabled(false);
            recentFilesMenu.add(emptyItem);
        } else {
            for (Path path : recentFiles) {
                JMenuItem item = new JMenuItem(path.getFileName().toString());
                item.setToolTipText(path.toString());
                item.addActionListener(e -> loadFromFileAsync(path));
                recentFilesMenu.add(item);
            }
            recentFilesMenu.addSeparator();
            JMenuItem clearItem = new JMenuItem("Clear Recent Files");
            clearItem.addActionListener(e -> {
                recentFiles.clear();
                updateRecentFilesMenu();
            });
            recentFilesMenu.add(clearItem);
        }
    }

    private void loadPreferences() {
        String recentFilesStr = prefs.get(PREF_RECENT_FILES, "");
        if (!recentFilesStr.isEmpty()) {
            for (String pathStr : recentFilesStr.split("\n")) {
                Path path = Path.of(pathStr);
                if (Files.exists(path)) {
                    recentFiles.add(path);
                }
            }
        }
    }

    private void savePreferences() {
        prefs.putInt(PREF_STYLE, styleCombo.getSelectedIndex());

        StringBuilder sb = new StringBuilder();
        for (Path path : recentFiles) {
            if (sb.length() > 0) sb.append("\n");
            sb.append(path);
        }
        prefs.put(PREF_RECENT_FILES, sb.toString());
    }

    private void showAboutDialog() {
        String message = """
            Citation Checker
            Version 1.0

            Checks in-text citations against the bibliography.

            Features:
            • APA, Vancouver and Chicago author-year citations
            • Missing / unused references, year and spelling mismatches
            • et al. and abbreviation usage, duplicate references
            • Numeric citation renumbering by first appearance
            • .txt, .md and .pdf manuscripts

            Run with a file argument for the command-line version.
            """;
        JOptionPane.showMessageDialog(frame, message, "About", JOptionPane.INFORMATION_MESSAGE);
    }

    private void showShortcutsDialog() {
        String cmdKey = System.getProperty("os.name").toLowerCase(Locale.ROOT).contains("mac") ? "⌘" : "Ctrl+";
        String message = String.format("""
            Keyboard Shortcuts:

            %sO        Open file
            %sS        Save report
            %sEnter    Check citations
            %sR        Renumber numeric citations
            %sL        Clear all
            %sShift+C  Copy report
            %sZ        Undo
            %sShift+Z  Redo
            %sQ        Quit
            """, cmdKey, cmdKey, cmdKey, cmdKey, cmdKey, cmdKey, cmdKey, cmdKey, cmdKey);
        JOptionPane.showMessageDialog(frame, message, "Keyboard Shortcuts", JOptionPane.INFORMATION_MESSAGE);
    }
}

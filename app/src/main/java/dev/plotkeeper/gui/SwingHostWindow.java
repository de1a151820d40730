package dev.plotkeeper.gui;

import dev.plotkeeper.daemon.connection.ConnectionState;
import dev.plotkeeper.daemon.connection.ConnectionStateListener;
import dev.plotkeeper.daemon.shutdown.HostWindow;
import java.awt.*;
import java.awt.event.WindowAdapter;
import java.awt.event.WindowEvent;
import java.util.concurrent.CompletableFuture;
import javax.swing.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * The desktop window. Closing it does not dispose the frame; the close request goes to the
 * registered handler (the shutdown coordinator), which closes the window once the daemon is down.
 */
public final class SwingHostWindow implements HostWindow, ConnectionStateListener {
    private static final Logger logger = LogManager.getLogger(SwingHostWindow.class);

    private static final Dimension CLOSING_SIZE = new Dimension(500, 500);

    private final JFrame frame;
    private final JLabel status;
    private volatile @Nullable Runnable closeHandler;

    public SwingHostWindow(String title) {
        assert SwingUtilities.isEventDispatchThread();
        frame = new JFrame(title);
        frame.setDefaultCloseOperation(JFrame.DO_NOTHING_ON_CLOSE);
        frame.setSize(1000, 700);
        frame.setLayout(new BorderLayout());

        status = new JLabel("Starting daemon…", SwingConstants.CENTER);
        status.setFont(status.getFont().deriveFont(Font.PLAIN, 16f));
        frame.add(status, BorderLayout.CENTER);

        frame.addWindowListener(new WindowAdapter() {
            @Override
            public void windowClosing(WindowEvent e) {
                var handler = closeHandler;
                if (handler != null) {
                    handler.run();
                } else {
                    frame.dispose();
                }
            }
        });
        frame.setLocationRelativeTo(null);
    }

    public void setCloseHandler(Runnable closeHandler) {
        this.closeHandler = closeHandler;
    }

    public void show() {
        SwingUtilities.invokeLater(() -> frame.setVisible(true));
    }

    @Override
    public CompletableFuture<Boolean> confirmExit() {
        var answer = new CompletableFuture<Boolean>();
        SwingUtilities.invokeLater(() -> {
            int confirm = JOptionPane.showConfirmDialog(
                    frame,
                    "Quitting will stop the daemon. Plotting and farming stop until you start it again.",
                    "Quit Plotkeeper?",
                    JOptionPane.YES_NO_OPTION,
                    JOptionPane.QUESTION_MESSAGE);
            answer.complete(confirm == JOptionPane.YES_OPTION);
        });
        return answer;
    }

    @Override
    public void showClosingPresentation() {
        SwingUtilities.invokeLater(() -> {
            frame.getContentPane().removeAll();
            var closing = new JLabel("Closing down the daemon…", SwingConstants.CENTER);
            frame.add(closing, BorderLayout.CENTER);
            frame.setSize(CLOSING_SIZE);
            frame.setLocationRelativeTo(null);
            frame.revalidate();
            frame.repaint();
        });
    }

    @Override
    public void close() {
        SwingUtilities.invokeLater(frame::dispose);
    }

    /** Shows a modal error; completes once the user dismissed it. */
    public CompletableFuture<Void> showStartupFailure(String message) {
        logger.error("Startup failed: {}", message);
        var dismissed = new CompletableFuture<Void>();
        SwingUtilities.invokeLater(() -> {
            JOptionPane.showMessageDialog(frame, message, "Could not start the daemon", JOptionPane.ERROR_MESSAGE);
            dismissed.complete(null);
        });
        return dismissed;
    }

    @Override
    public void onStateChanged(ConnectionState previous, ConnectionState current) {
        String text = switch (current) {
            case CONNECTING -> "Connecting to the daemon…";
            case CONNECTED -> "Connected to the daemon";
            case CLOSING -> "Exiting…";
            case DISCONNECTED -> "Disconnected from the daemon";
        };
        SwingUtilities.invokeLater(() -> status.setText(text));
    }

    @Override
    public void onConnectionTrouble(int consecutiveFailures, Throwable lastFailure) {
        SwingUtilities.invokeLater(() -> status.setText(
                "Still trying to reach the daemon (" + consecutiveFailures + " attempts): "
                        + lastFailure.getMessage()));
    }
}

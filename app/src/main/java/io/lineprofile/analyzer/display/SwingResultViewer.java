package io.lineprofile.analyzer.display;

import io.lineprofile.analyzer.annotate.AnnotatedImages;
import io.lineprofile.analyzer.chart.ChartGrid;
import io.lineprofile.analyzer.sample.Channel;
import java.awt.Dimension;
import java.awt.Graphics;
import java.awt.GraphicsEnvironment;
import java.awt.GridLayout;
import java.awt.event.KeyAdapter;
import java.awt.event.KeyEvent;
import java.awt.event.WindowAdapter;
import java.awt.event.WindowEvent;
import java.awt.image.BufferedImage;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import javax.swing.JFrame;
import javax.swing.JPanel;
import javax.swing.SwingUtilities;
import javax.swing.WindowConstants;
import org.jfree.chart.ChartPanel;
import org.jfree.chart.JFreeChart;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens chart and image windows and blocks until a key is pressed in one of the image windows.
 */
public class SwingResultViewer implements ResultViewer {

    private static final Logger LOGGER = LoggerFactory.getLogger(SwingResultViewer.class);

    static final int IMAGE_WINDOW_SIZE = 600;

    private final int chartWidth;
    private final int chartHeight;

    public SwingResultViewer(int chartWidth, int chartHeight) {
        this.chartWidth = chartWidth;
        this.chartHeight = chartHeight;
    }

    @Override
    public void show(ChartGrid plots, ChartGrid histograms, AnnotatedImages images) {
        if (GraphicsEnvironment.isHeadless()) {
            LOGGER.warn("Display requested but the JVM is headless; skipping preview windows");
            return;
        }
        CountDownLatch dismissed = new CountDownLatch(1);
        List<JFrame> frames = new ArrayList<>();
        try {
            SwingUtilities.invokeAndWait(() -> {
                frames.add(chartFrame(plots));
                frames.add(chartFrame(histograms));
                for (Map.Entry<String, BufferedImage> entry : windowImages(images).entrySet()) {
                    frames.add(imageFrame(entry.getKey(), entry.getValue(), dismissed));
                }
                frames.forEach(frame -> frame.setVisible(true));
            });
            LOGGER.info("Press any key in an image window to close the previews");
            dismissed.await();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        } catch (InvocationTargetException ex) {
            throw new IllegalStateException("Failed to open preview windows", ex.getCause());
        } finally {
            SwingUtilities.invokeLater(() -> frames.forEach(JFrame::dispose));
        }
    }

    private static Map<String, BufferedImage> windowImages(AnnotatedImages images) {
        Map<String, BufferedImage> windows = new LinkedHashMap<>();
        windows.put(Channel.BLUE.displayName(), images.blue());
        windows.put(Channel.GREEN.displayName(), images.green());
        windows.put(Channel.RED.displayName(), images.red());
        windows.put("Original", images.original());
        return windows;
    }

    private JFrame chartFrame(ChartGrid grid) {
        JFrame frame = new JFrame(grid.title());
        JPanel panel = new JPanel(new GridLayout(grid.rows(), grid.columns()));
        for (JFreeChart chart : grid.charts()) {
            panel.add(new ChartPanel(chart));
        }
        panel.setPreferredSize(new Dimension(chartWidth, chartHeight));
        frame.setContentPane(panel);
        frame.setDefaultCloseOperation(WindowConstants.DISPOSE_ON_CLOSE);
        frame.pack();
        return frame;
    }

    private static JFrame imageFrame(String title, BufferedImage image, CountDownLatch dismissed) {
        JFrame frame = new JFrame(title);
        frame.setContentPane(new ScaledImagePanel(image));
        frame.setSize(IMAGE_WINDOW_SIZE, IMAGE_WINDOW_SIZE);
        frame.setResizable(true);
        frame.setDefaultCloseOperation(WindowConstants.DISPOSE_ON_CLOSE);
        frame.addKeyListener(new KeyAdapter() {
            @Override
            public void keyPressed(KeyEvent event) {
                dismissed.countDown();
            }
        });
        frame.addWindowListener(new WindowAdapter() {
            @Override
            public void windowClosed(WindowEvent event) {
                dismissed.countDown();
            }
        });
        return frame;
    }

    private static final class ScaledImagePanel extends JPanel {

        private final transient BufferedImage image;

        private ScaledImagePanel(BufferedImage image) {
            this.image = image;
        }

        @Override
        protected void paintComponent(Graphics graphics) {
            super.paintComponent(graphics);
            double scale = Math.min((double) getWidth() / image.getWidth(), (double) getHeight() / image.getHeight());
            int width = (int) Math.round(image.getWidth() * scale);
            int height = (int) Math.round(image.getHeight() * scale);
            graphics.drawImage(image, (getWidth() - width) / 2, (getHeight() - height) / 2, width, height, null);
        }
    }
}

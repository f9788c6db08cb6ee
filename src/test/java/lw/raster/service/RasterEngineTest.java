package lw.raster.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import lw.raster.TestImages;
import lw.raster.model.OutputEvent;
import lw.raster.model.RasterGeometry;
import lw.raster.model.RasterSettings;
import lw.raster.utilities.Tile;
import lw.raster.utilities.TilingUtilities;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.awt.image.BufferedImage;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Unit tests for the RasterEngine message protocol.
 *
 * <p>The engine is driven synchronously, either through {@link RasterEngine#handle} or by
 * running it on the test thread with a pre-filled inbox.</p>
 */
@ExtendWith(MockitoExtension.class)
class RasterEngineTest {

    @Mock
    private EngineOutput output;

    private BlockingQueue<EngineMessage> inbox;
    private RasterEngine engine;

    private RasterSettings settings;
    private RasterGeometry geometry;
    private Tile[][] tiles;

    @BeforeEach
    void setUp() {
        inbox = new LinkedBlockingQueue<>();
        engine = new RasterEngine(inbox, output);

        settings = new RasterSettings.Builder().trimLine(false).verboseG(true).build();
        BufferedImage image = TestImages.uniform(3, 3, 0);
        geometry = TestImages.geometry(3, 3, 2);
        tiles = TilingUtilities.buildTiles(image, geometry, false);
    }

    private void postAll() {
        inbox.add(EngineMessage.init(settings, geometry, "1.0.0"));
        for (Tile[] row : tiles) {
            for (Tile tile : row) {
                inbox.add(EngineMessage.addCell(tile));
            }
        }
        inbox.add(EngineMessage.parse());
    }

    // ==================== Successful runs ====================

    @Test
    @DisplayName("Full message sequence yields header, one event per line, done, completion")
    void testFullRun() {
        postAll();

        engine.run();

        assertEquals(RasterEngine.State.DONE, engine.getState());
        InOrder order = inOrder(output);
        order.verify(output).publish(argThat(e -> e.getType() == OutputEvent.Type.HEADER));
        order.verify(output, times(3)).publish(argThat(e -> e.getType() == OutputEvent.Type.GCODE));
        order.verify(output).publish(OutputEvent.done());
        order.verify(output).complete(eq(3), anyLong());
        verify(output, never()).fail(any());
    }

    @Test
    @DisplayName("Events carry row progress and the header text")
    void testEventContent() {
        postAll();

        engine.run();

        ArgumentCaptor<OutputEvent> captor = ArgumentCaptor.forClass(OutputEvent.class);
        verify(output, times(5)).publish(captor.capture());
        List<OutputEvent> events = captor.getAllValues();

        assertTrue(events.get(0).getText().startsWith("; Generated by lw-rasterizer - 1.0.0"));
        assertEquals(0, events.get(1).getPercent());
        assertEquals(33, events.get(2).getPercent());
        assertEquals(67, events.get(3).getPercent());
        assertTrue(events.get(4).isDone());

        // 1 travel + 3 burns per row
        verify(output).complete(3, 12L);
    }

    @Test
    @DisplayName("Tiles may be posted in any order")
    void testTilesOutOfOrder() {
        engine.handle(EngineMessage.init(settings, geometry, "1.0.0"));
        engine.handle(EngineMessage.addCell(tiles[1][1]));
        engine.handle(EngineMessage.addCell(tiles[0][0]));
        engine.handle(EngineMessage.addCell(tiles[1][0]));
        engine.handle(EngineMessage.addCell(tiles[0][1]));
        engine.handle(EngineMessage.parse());

        assertEquals(RasterEngine.State.DONE, engine.getState());
        verify(output).publish(OutputEvent.done());
    }

    // ==================== Protocol errors ====================

    @Test
    @DisplayName("ADD_CELL before INIT is rejected")
    void testAddCellBeforeInit() {
        assertThrows(IllegalStateException.class, () -> engine.handle(EngineMessage.addCell(tiles[0][0])));
        verifyNoInteractions(output);
    }

    @Test
    @DisplayName("PARSE before INIT is rejected")
    void testParseBeforeInit() {
        assertThrows(IllegalStateException.class, () -> engine.handle(EngineMessage.parse()));
    }

    @Test
    @DisplayName("A second INIT is rejected")
    void testDoubleInit() {
        engine.handle(EngineMessage.init(settings, geometry, "1.0.0"));
        assertThrows(IllegalStateException.class,
                () -> engine.handle(EngineMessage.init(settings, geometry, "1.0.0")));
    }

    @Test
    @DisplayName("PARSE with missing tiles is rejected before any output")
    void testParseWithMissingTiles() {
        engine.handle(EngineMessage.init(settings, geometry, "1.0.0"));
        engine.handle(EngineMessage.addCell(tiles[0][0]));

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> engine.handle(EngineMessage.parse()));
        assertTrue(e.getMessage().contains("1 of 4"));
        verify(output, never()).publish(any());
    }

    @Test
    @DisplayName("Protocol errors during run() fail the output without a DONE event")
    void testRunReportsFailure() {
        inbox.add(EngineMessage.addCell(tiles[0][0]));

        engine.run();

        assertEquals(RasterEngine.State.FAILED, engine.getState());
        verify(output).fail(any(IllegalStateException.class));
        verify(output, never()).publish(any());
        verify(output, never()).complete(anyInt(), anyLong());
    }

    // ==================== Cancellation ====================

    @Test
    @DisplayName("Cancellation stops the scan after the header")
    void testCancellation() {
        when(output.isCancelled()).thenReturn(false, true);
        postAll();

        engine.run();

        assertEquals(RasterEngine.State.FAILED, engine.getState());
        verify(output).publish(argThat(e -> e.getType() == OutputEvent.Type.HEADER));
        verify(output, times(1)).publish(argThat(e -> e.getType() == OutputEvent.Type.GCODE));
        verify(output, never()).publish(OutputEvent.done());
        verify(output).fail(any(CancellationException.class));
        verify(output, never()).complete(anyInt(), anyLong());
    }
}

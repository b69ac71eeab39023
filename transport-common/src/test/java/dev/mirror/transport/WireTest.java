package dev.mirror.transport;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import dev.mirror.transport.message.ChannelMessage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

class WireTest {

    private Logger wireLogger;
    private Level previousLevel;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void setUp() {
        wireLogger = (Logger) LoggerFactory.getLogger("WIRE");
        previousLevel = wireLogger.getLevel();
        wireLogger.setLevel(Level.INFO);
        appender = new ListAppender<>();
        appender.start();
        wireLogger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        wireLogger.detachAppender(appender);
        wireLogger.setLevel(previousLevel);
    }

    @Test
    void framesAreLoggedAtTheConfiguredInfoLevel() {
        Wire.tx("c1", new ChannelMessage.Ready());
        Wire.rx("c1", new ChannelMessage.Ready());

        assertThat(appender.list).hasSize(2);
        assertThat(appender.list).allSatisfy(event -> assertThat(event.getLevel()).isEqualTo(Level.INFO));
        assertThat(appender.list.get(0).getFormattedMessage()).startsWith("TX conn=c1 type=ready");
        assertThat(appender.list.get(1).getFormattedMessage()).startsWith("RX conn=c1 type=ready");
    }

    @Test
    void longDescriptionsAreTruncated() {
        assertThat(Wire.truncate("abcdef", 3)).isEqualTo("abc...");
        assertThat(Wire.truncate("abc", 3)).isEqualTo("abc");
        assertThat(Wire.truncate(null, 3)).isNull();
    }
}

package org.hyphenmon.alert.engine.state;

import com.typesafe.config.Config;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.store.DeliveryStore;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.store.InMemoryDeliveryStore;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.store.InMemoryWatermarkStore;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.store.WatermarkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the watermark and delivery stores from the {@code state} block. {@code type = file}
 * keeps them as JSON files under {@code state.dir}; {@code type = memory} loses them on restart.
 */
public class StateStores {
  private static final Logger LOGGER = LoggerFactory.getLogger(StateStores.class);
  public static final String STATE_CONFIG = "state";
  static final String TYPE = "type";
  static final String DIR = "dir";
  static final String TYPE_FILE = "file";
  static final String TYPE_MEMORY = "memory";
  static final String WATERMARK_FILE = "watermark.json";
  static final String DELIVERY_FILE = "delivery-records.json";

  private final WatermarkStore watermarkStore;
  private final DeliveryStore deliveryStore;

  private StateStores(WatermarkStore watermarkStore, DeliveryStore deliveryStore) {
    this.watermarkStore = watermarkStore;
    this.deliveryStore = deliveryStore;
  }

  public static StateStores from(Config appConfig) throws IOException {
    Config stateConfig = appConfig.getConfig(STATE_CONFIG);
    String type = stateConfig.getString(TYPE);
    switch (type) {
      case TYPE_FILE:
        Path dir = Paths.get(stateConfig.getString(DIR));
        LOGGER.info("Keeping watermark and delivery records under {}", dir.toAbsolutePath());
        return new StateStores(
            new FileWatermarkStore(dir.resolve(WATERMARK_FILE)),
            new FileDeliveryStore(dir.resolve(DELIVERY_FILE)));
      case TYPE_MEMORY:
        LOGGER.warn("Watermark and delivery records are kept in memory only");
        return new StateStores(new InMemoryWatermarkStore(), new InMemoryDeliveryStore());
      default:
        throw new RuntimeException(String.format("Invalid state store type:%s", type));
    }
  }

  public WatermarkStore getWatermarkStore() {
    return watermarkStore;
  }

  public DeliveryStore getDeliveryStore() {
    return deliveryStore;
  }
}

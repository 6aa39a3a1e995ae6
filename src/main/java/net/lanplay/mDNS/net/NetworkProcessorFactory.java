package net.lanplay.mDNS.net;

import java.util.List;
import net.lanplay.mDNS.EngineConfig;
import net.lanplay.mDNS.ServiceSessionException;
import net.lanplay.mDNS.utils.Executors;

/**
 * Opens the network endpoints of an engine. The processors are returned unstarted.
 */
public interface NetworkProcessorFactory {

  /**
   * @throws ServiceSessionException if not a single endpoint could be opened
   */
  List<NetworkProcessor> open(EngineConfig config, PacketListener listener, Executors executors)
      throws ServiceSessionException;
}

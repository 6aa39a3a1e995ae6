package net.lanplay.mDNS;

import net.lanplay.mDNS.model.DiscoveredService;

/**
 * Receives the events of a browse session from {@link ServiceSessionManager#process()}, on the
 * thread calling it.
 */
public interface BrowseListener {
  void serviceDiscovered(BrowseHandle handle, DiscoveredService service);

  void serviceUpdated(BrowseHandle handle, DiscoveredService service);

  /**
   * @param service The last resolved state of the service, in state
   * {@link DiscoveredService.State#REMOVED}
   */
  void serviceRemoved(BrowseHandle handle, DiscoveredService service);

  /**
   * The session failed and has been stopped. Start a new one to resume browsing.
   */
  void browseError(BrowseHandle handle, ServiceSessionException e);
}

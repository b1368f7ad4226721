/** Ports through which other modules read and update settings without touching the file. */
@NamedInterface("api")
package cafe.woden.cui.config.api;

import org.springframework.modulith.NamedInterface;

package cafe.woden.cui.config;

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.util.Enumeration;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Generates the installation's machine id: {@code <host>-<8 hex digits>}.
 *
 * <p>Only called when the settings file has no id yet; the loaded id always wins afterwards.
 */
@Component
public class MachineIdGenerator {

  private static final Logger log = LoggerFactory.getLogger(MachineIdGenerator.class);

  public String generate() {
    String host = hostName();
    Hasher hasher = Hashing.sha256().newHasher().putString(host, StandardCharsets.UTF_8);
    byte[] hw = hardwareAddress();
    if (hw != null) {
      hasher.putBytes(hw);
    } else {
      hasher.putString(UUID.randomUUID().toString(), StandardCharsets.UTF_8);
    }
    return host + "-" + hasher.hash().toString().substring(0, 8);
  }

  static String normalizeHost(String raw) {
    String s = Objects.toString(raw, "").trim().toLowerCase(Locale.ROOT);
    int dot = s.indexOf('.');
    if (dot > 0) s = s.substring(0, dot);
    s = s.replaceAll("[^a-z0-9-]", "-");
    return s.isEmpty() ? "cui" : s;
  }

  private static String hostName() {
    try {
      return normalizeHost(InetAddress.getLocalHost().getHostName());
    } catch (UnknownHostException e) {
      log.debug("[cui] Local host name unavailable, using HOSTNAME", e);
      return normalizeHost(System.getenv("HOSTNAME"));
    }
  }

  private static byte[] hardwareAddress() {
    try {
      Enumeration<NetworkInterface> nics = NetworkInterface.getNetworkInterfaces();
      while (nics != null && nics.hasMoreElements()) {
        NetworkInterface nic = nics.nextElement();
        if (nic.isLoopback() || nic.isVirtual()) continue;
        byte[] mac = nic.getHardwareAddress();
        if (mac != null && mac.length > 0 && !allZero(mac)) return mac;
      }
    } catch (SocketException e) {
      log.debug("[cui] Could not enumerate network interfaces", e);
    }
    return null;
  }

  private static boolean allZero(byte[] bytes) {
    for (byte b : bytes) {
      if (b != 0) return false;
    }
    return true;
  }
}

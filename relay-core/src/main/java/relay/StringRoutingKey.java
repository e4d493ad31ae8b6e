package relay;

import java.util.Objects;

/**
 * A routing key built from a plain string, for keys only known at runtime.
 */
public final class StringRoutingKey implements RoutingKey {

  private final String name;

  private StringRoutingKey(String name) {
    this.name = Objects.requireNonNull(name, "name");
    if (name.isEmpty()) {
      throw new IllegalArgumentException("Routing key cannot be empty");
    }
  }

  /**
   * Creates a routing key from a string.
   *
   * @param name the routing key
   * @return the routing key
   * @throws NullPointerException if name is null
   * @throws IllegalArgumentException if name is empty
   */
  public static StringRoutingKey of(String name) {
    return new StringRoutingKey(name);
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof StringRoutingKey)) return false;
    StringRoutingKey that = (StringRoutingKey) o;
    return name.equals(that.name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String toString() {
    return name;
  }
}

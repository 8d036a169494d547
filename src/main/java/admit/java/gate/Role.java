package admit.java.gate;

public enum Role {
    USER,
    ADMIN
}

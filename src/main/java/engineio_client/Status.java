package engineio_client;

public enum Status {

    CLOSED, // Default state, and the state after any disconnect.
    OPENING, // A dial is in progress, or the connection is open but the handshake hasn't arrived yet.
    CONNECTED; // The OPEN packet was received and processed.
}

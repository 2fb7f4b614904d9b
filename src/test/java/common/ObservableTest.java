package common;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import java.util.Arrays;
import java.util.LinkedList;
import java.util.List;

import common.Observable.Callback;
import common.Observable.CallbackHandle;

import static org.junit.Assert.*;

public class ObservableTest {

    private final Observable<Object> observable = new Observable<>();

    @Before
    public void beforeEach() {
       observable.removeAllListeners();
    }

    @Test
    public void testEmitWithArg() {
        Object testObj = new Object();
        List<Object> list = new LinkedList<>();

        observable.on(list::add);
        observable.on(list::add);
        observable.emitEvent(testObj);

        assertEquals(list, Arrays.asList(testObj, testObj));
    }

    @Test
    public void testEmitNullArg() {
        int[] arr = {0};
        observable.on(Assert::assertNull);
        observable.on(arg -> arr[0]++);
        observable.emitEvent(null);

        assertEquals(1, arr[0]);
    }

    @Test
    public void testCallbacksRunInRegistrationOrder() {
        List<String> order = new LinkedList<>();
        observable.on(arg -> order.add("first"));
        observable.once(arg -> order.add("second"));
        observable.on(arg -> order.add("third"));

        observable.emitEvent("");
        assertEquals(Arrays.asList("first", "second", "third"), order);
    }

    @Test
    public void testOnce() {
        int[] arr = {0};
        observable.once(arg -> arr[0]++);

        assertEquals(observable.size(), 1);
        observable.emitEvent("");
        assertEquals(arr[0], 1);

        assertEquals(observable.size(), 0);
        observable.emitEvent("");
        assertEquals(arr[0], 1);
    }

    @Test
    public void testOnceIsNotCalledAgainByReentrantEmit() {
        int[] arr = {0};
        observable.once(arg -> {
            arr[0]++;
            observable.emitEvent("again");
        });

        observable.emitEvent("");
        assertEquals(1, arr[0]);
    }

    @Test
    public void testRegisterFromCallback() {
        int[] arr = {0};
        observable.once(arg -> observable.on(inner -> arr[0]++));

        observable.emitEvent("");
        assertEquals(0, arr[0]);
        observable.emitEvent("");
        assertEquals(1, arr[0]);
    }

    @Test
    public void testRemoveListener() {
        Callback<Object> cb = arg -> {};
        Callback<Object> cb2 = arg -> {};

        observable.on(cb);
        observable.on(cb2);
        assertEquals(2, observable.size());

        observable.removeListener(cb);
        assertEquals(1, observable.size());

        observable.on(cb);
        observable.removeAllListeners();
        assertEquals(0, observable.size());
    }

    @Test
    public void testCallbackHandleRemove() {
        int[] arr = {0};
        CallbackHandle handle = observable.on(arg -> arr[0]++);
        assertEquals(1, observable.size());

        handle.remove();
        assertEquals(0, observable.size());
        observable.emitEvent("");
        assertEquals(0, arr[0]);

        // Removing twice is harmless.
        handle.remove();
    }

    @Test
    public void testNullCallback() {
        assertThrows(NullPointerException.class, () -> observable.on(null));
    }
}

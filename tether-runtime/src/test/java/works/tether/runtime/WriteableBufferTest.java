package works.tether.runtime;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WriteableBufferTest {
	@Test
	void empty() {
		WriteableBuffer buffer = new WriteableBuffer();
		assertEquals("", buffer.contents());
		assertEquals(WriteableBuffer.DEFAULT_CAPACITY, buffer.cap.longValue());
		assertFalse(buffer.growFailed());
		assertFalse(buffer.isFlushed());
	}

	@Test
	void append_growsPastInitialCapacity() {
		WriteableBuffer buffer = new WriteableBuffer(4);
		buffer.append("hello");
		buffer.append(", wörld");
		assertEquals("hello, wörld", buffer.contents());
		assertEquals(14, buffer.len.longValue());
		assertTrue(buffer.cap.longValue() >= 14);
		assertFalse(buffer.growFailed());
	}

	@Test
	void callbacksAreInstalled() {
		WriteableBuffer buffer = new WriteableBuffer(2);
		buffer.flush.invoke(null);
		assertTrue(buffer.isFlushed());
	}
}

package org.neuralchilli.pipeflow.serializer;

import com.hazelcast.nio.ObjectDataInput;
import com.hazelcast.nio.ObjectDataOutput;
import com.hazelcast.nio.serialization.StreamSerializer;
import org.neuralchilli.pipeflow.store.ObjectKey;

import java.io.IOException;

/**
 * Compact serializer for the map key of every control-plane store.
 * Two length-prefixed strings; the empty namespace is written as an empty string.
 */
public class ObjectKeySerializer implements StreamSerializer<ObjectKey> {

    public static final int TYPE_ID = 1001;

    @Override
    public int getTypeId() {
        return TYPE_ID;
    }

    @Override
    public void write(ObjectDataOutput out, ObjectKey key) throws IOException {
        out.writeString(key.namespace());
        out.writeString(key.name());
    }

    @Override
    public ObjectKey read(ObjectDataInput in) throws IOException {
        String namespace = in.readString();
        String name = in.readString();
        return new ObjectKey(namespace, name);
    }

    @Override
    public void destroy() {
    }
}

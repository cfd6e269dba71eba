package io.vena.nodesim.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationConfig;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.Module;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.Deserializers;
import com.fasterxml.jackson.databind.ser.Serializers;
import io.vena.nodesim.AP;
import io.vena.nodesim.Address;
import io.vena.nodesim.Node;
import io.vena.nodesim.RT;
import io.vena.nodesim.exceptions.MalformedAddressException;
import java.io.IOException;

/**
 * Jackson support for reporting topologies as JSON.
 *
 * <ul>
 *     <li>
 *         {@link Address}es are written as their {@link Address#tag() tag} strings,
 *         and read back with {@link Address#parse}.
 *     </li>
 *     <li>
 *         {@link Node}s are written with their kind and id. An {@link AP} adds the ids of its
 *         members in ascending order, and an {@link RT} adds the id of its owner, or null.
 *         Nodes can't be read back; the object graph has no serialized form.
 *     </li>
 * </ul>
 *
 * Heartbeat statistics are records and need no special handling.
 */
public final class NodeSimJacksonModule extends Module {

	@Override
	public String getModuleName() {
		return getClass().getSimpleName();
	}

	@Override
	public Version version() {
		return Version.unknownVersion();
	}

	@Override
	public void setupModule(SetupContext context) {
		context.addSerializers(new NodeSimSerializers());
		context.addDeserializers(new NodeSimDeserializers());
	}

	private static final class NodeSimSerializers extends Serializers.Base {
		@Override
		public JsonSerializer<?> findSerializer(SerializationConfig config, JavaType type, BeanDescription beanDesc) {
			Class<?> theClass = type.getRawClass();
			if (Address.class.isAssignableFrom(theClass)) {
				return ADDRESS_SERIALIZER;
			} else if (Node.class.isAssignableFrom(theClass)) {
				return NODE_SERIALIZER;
			} else {
				return null;
			}
		}
	}

	private static final class NodeSimDeserializers extends Deserializers.Base {
		@Override
		public JsonDeserializer<?> findBeanDeserializer(JavaType type, DeserializationConfig config, BeanDescription beanDesc) {
			Class<?> theClass = type.getRawClass();
			if (Address.class.isAssignableFrom(theClass)) {
				return ADDRESS_DESERIALIZER;
			} else if (Node.class.isAssignableFrom(theClass)) {
				return nodeDeserializer(theClass);
			} else {
				return null;
			}
		}
	}

	private static final JsonSerializer<Address> ADDRESS_SERIALIZER = new JsonSerializer<Address>() {
		@Override
		public void serialize(Address value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
			gen.writeString(value.tag());
		}
	};

	private static final JsonDeserializer<Address> ADDRESS_DESERIALIZER = new JsonDeserializer<Address>() {
		@Override
		public Address deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
			if (p.currentToken() != JsonToken.VALUE_STRING) {
				return (Address) ctxt.handleUnexpectedToken(Address.class, p);
			}
			String tag = p.getText();
			try {
				return Address.parse(tag);
			} catch (MalformedAddressException e) {
				throw JsonMappingException.from(p, e.getMessage(), e);
			}
		}
	};

	private static final JsonSerializer<Node> NODE_SERIALIZER = new JsonSerializer<Node>() {
		@Override
		public void serialize(Node value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
			gen.writeStartObject();
			gen.writeStringField("kind", value.kind());
			gen.writeNumberField("id", value.id());
			if (value instanceof AP) {
				int[] memberIds = ((AP) value).members().stream()
					.mapToInt(Node::id)
					.sorted()
					.toArray();
				gen.writeFieldName("members");
				gen.writeArray(memberIds, 0, memberIds.length);
			} else if (value instanceof RT) {
				AP owner = ((RT) value).owner();
				if (owner == null) {
					gen.writeNullField("owner");
				} else {
					gen.writeNumberField("owner", owner.id());
				}
			}
			gen.writeEndObject();
		}
	};

	private static JsonDeserializer<Node> nodeDeserializer(Class<?> nodeClass) {
		return new JsonDeserializer<Node>() {
			@Override
			public Node deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
				throw JsonMappingException.from(p, "Cannot deserialize " + nodeClass.getSimpleName() + "; nodes are write-only");
			}
		};
	}
}

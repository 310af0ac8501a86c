package com.fixcraft.romclua;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class TableMarshallerTest {
    private FakeLuaApi api;
    private long state;

    @BeforeEach
    void setUp() {
        api = new FakeLuaApi();
        state = api.newState();
    }

    private LuaValue marshal(Object value) {
        api.push(state, value);
        int top = api.getTop(state);
        LuaValue result = new TableMarshaller(api, state).read(-1);
        assertThat(api.getTop(state)).as("stack balanced").isEqualTo(top);
        return result;
    }

    @Test
    void read_denseIntegerKeys_isArray() {
        LuaValue value = marshal(api.list("a", "b", "c"));

        assertThat(value.type()).isEqualTo(LuaValue.Type.ARRAY);
        assertThat(value.toJava()).isEqualTo(Arrays.asList("a", "b", "c"));
    }

    @Test
    void read_integerKeysWithGap_isMap() {
        FakeLuaApi.FakeTable table = api.table()
            .put(Long.valueOf(1), "v1")
            .put(Long.valueOf(3), "v3");

        LuaValue value = marshal(table);

        assertThat(value.type()).isEqualTo(LuaValue.Type.MAP);
        assertThat(LuaJson.toJson(value)).isEqualTo("{\"1\":\"v1\",\"3\":\"v3\"}");
    }

    @Test
    void read_selfReference_isNullAtRevisit() {
        FakeLuaApi.FakeTable table = api.table().put("id", Long.valueOf(1));
        table.put("self", table);

        LuaValue value = marshal(table);

        assertThat(value.get("id").asLong()).isEqualTo(1L);
        assertThat(value.get("self").isNil()).isTrue();
        assertThat(value.asMap()).containsKey("self");
    }

    @Test
    void read_indirectCycle_isNullAtRevisit() {
        FakeLuaApi.FakeTable parent = api.table().put("name", "parent");
        FakeLuaApi.FakeTable child = api.table().put("name", "child").put("parent", parent);
        parent.put("child", child);

        LuaValue value = marshal(parent);

        assertThat(value.get("child").get("name").asString()).isEqualTo("child");
        assertThat(value.get("child").get("parent").isNil()).isTrue();
    }

    @Test
    void read_sharedTableInSiblings_isCopiedIntoEach() {
        FakeLuaApi.FakeTable shared = api.table().put("a", Long.valueOf(1));
        FakeLuaApi.FakeTable root = api.table().put("x", shared).put("y", shared);

        LuaValue value = marshal(root);

        assertThat(value.get("x").get("a").asLong()).isEqualTo(1L);
        assertThat(value.get("y").get("a").asLong()).isEqualTo(1L);
    }

    @Test
    void read_numbers_keepInterpreterSubtype() {
        FakeLuaApi.FakeTable table = api.table()
            .put("int", Long.valueOf(1))
            .put("float", Double.valueOf(1.0));

        LuaValue value = marshal(table);

        assertThat(value.get("int").type()).isEqualTo(LuaValue.Type.INTEGER);
        assertThat(value.get("float").type()).isEqualTo(LuaValue.Type.NUMBER);
    }

    @Test
    void read_nonIntegerKeys_useLuaStringForm() {
        FakeLuaApi.FakeTable table = api.table()
            .put(Double.valueOf(1.5), "half")
            .put(Boolean.TRUE, "yes")
            .put(Long.valueOf(1), "one");

        LuaValue value = marshal(table);

        assertThat(value.asMap().keySet()).containsExactly("1.5", "true", "1");
    }

    @Test
    void read_emptyTable_isEmptyMap() {
        assertThat(marshal(api.table())).isEqualTo(LuaValue.emptyMap());
    }

    @Test
    void read_scalars_mapToValues() {
        assertThat(marshal("héllo").asString()).isEqualTo("héllo");
        assertThat(marshal(Boolean.FALSE)).isEqualTo(LuaValue.FALSE);
        assertThat(marshal(null)).isEqualTo(LuaValue.NIL);
    }

    @Test
    void read_nestedArrays_recurse() {
        LuaValue value = marshal(api.list(api.list(Long.valueOf(1), Long.valueOf(2)), api.table()));

        assertThat(LuaJson.toJson(value)).isEqualTo("[[1,2],{}]");
    }
}

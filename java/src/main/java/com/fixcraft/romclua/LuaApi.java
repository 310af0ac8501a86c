package com.fixcraft.romclua;

public interface LuaApi {
    int LUA_OK = 0;

    int LUA_TNONE = -1;
    int LUA_TNIL = 0;
    int LUA_TBOOLEAN = 1;
    int LUA_TLIGHTUSERDATA = 2;
    int LUA_TNUMBER = 3;
    int LUA_TSTRING = 4;
    int LUA_TTABLE = 5;
    int LUA_TFUNCTION = 6;

    int LUA_REGISTRYINDEX = -1001000;

    long newState();

    void openLibs(long state);

    void close(long state);

    int loadBuffer(long state, byte[] buffer, String chunkName);

    int dump(long state, ChunkWriter writer, boolean strip);

    int pcall(long state, int nargs, int nresults, int msgh);

    int getGlobal(long state, String name);

    int type(long state, int index);

    void pushNil(long state);

    int next(long state, int index);

    int getTop(long state);

    void setTop(long state, int index);

    long toInteger(long state, int index);

    double toNumber(long state, int index);

    boolean isInteger(long state, int index);

    boolean toBoolean(long state, int index);

    byte[] toLString(long state, int index);

    long toPointer(long state, int index);

    interface ChunkWriter {
        // 0 continues the dump, anything else aborts it
        int write(byte[] block);
    }
}

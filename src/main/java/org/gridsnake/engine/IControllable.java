package org.gridsnake.engine;

public interface IControllable {
    void start();
    void pause();
    void resume();
    void shutdown();
    boolean isPaused();
    boolean isRunning();
}

package com.example.lmsreport.pipeline;

/**
 * パイプラインの進捗を通知するためのインターフェース。
 * ReportPipelineOrchestrator が呼び出し側 (ジョブ管理など) に状態を伝えるために使用する。
 */
public interface PipelineProgressListener {

    PipelineProgressListener NONE = (stage, message) -> { };

    /**
     * @param stage   開始したステージ
     * @param message ユーザーに表示するメッセージ
     */
    void onStageStarted(PipelineStage stage, String message);
}

package com.mini.parquet.reader;

import com.google.common.base.Preconditions;
import com.mini.parquet.data.RowRecord;
import com.mini.parquet.format.ColumnarFile;
import com.mini.parquet.format.RowGroupReader;
import com.mini.parquet.format.TypedValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Columnar Row Reader
 * 单遍扫描整个列式文件：按存储顺序遍历行组，再遍历行组内的行
 *
 * 职责：
 * 1. 丢弃前 skipRows 行，完全落在跳过范围内的行组直接在源头跳过，不做解码
 * 2. 已返回 rowLimit 行后停止，剩余行组不再读取
 * 3. 按投影组装 {@link RowRecord}
 *
 * 读取器持有文件句柄，close 时释放
 */
public class ColumnarRowReader implements RecordReader<RowRecord> {
    private static final Logger logger = LoggerFactory.getLogger(ColumnarRowReader.class);

    private final ColumnarFile file;
    private final ReadOptions options;
    private final RowAssembler assembler;

    private RowGroupReader currentGroup;

    /** 已消费（读取或跳过）的行组数量 */
    private int groupsConsumed = 0;

    /** 已经过的行数，包括被跳过的行 */
    private long rowsEncountered = 0;

    /** 已返回的行数 */
    private long rowsEmitted = 0;

    private boolean exhausted = false;

    public ColumnarRowReader(ColumnarFile file, ReadOptions options) {
        this.file = Preconditions.checkNotNull(file, "file");
        this.options = Preconditions.checkNotNull(options, "options");
        this.assembler = new RowAssembler(file.fields(), options.getColumns());
    }

    @Override
    public RowRecord readRecord() throws IOException {
        if (exhausted) {
            return null;
        }
        if (options.isLimited() && rowsEmitted >= options.getRowLimit()) {
            exhausted = true;
            return null;
        }

        while (true) {
            if (currentGroup == null) {
                skipRowGroupsInSkipRange();
                currentGroup = file.nextRowGroup();
                if (currentGroup == null) {
                    exhausted = true;
                    return null;
                }
                groupsConsumed++;
            }

            List<TypedValue> values = currentGroup.readRecord();
            if (values == null) {
                currentGroup.close();
                currentGroup = null;
                continue;
            }

            if (rowsEncountered++ < options.getSkipRows()) {
                continue;
            }
            rowsEmitted++;
            return assembler.assemble(values);
        }
    }

    private void skipRowGroupsInSkipRange() throws IOException {
        while (groupsConsumed < file.numRowGroups()) {
            long groupRows = file.rowGroupRowCount(groupsConsumed);
            if (rowsEncountered + groupRows > options.getSkipRows()) {
                return;
            }
            if (!file.skipNextRowGroup()) {
                return;
            }
            groupsConsumed++;
            rowsEncountered += groupRows;
        }
    }

    public long getRowsEncountered() {
        return rowsEncountered;
    }

    public long getRowsEmitted() {
        return rowsEmitted;
    }

    @Override
    public void close() throws IOException {
        try {
            if (currentGroup != null) {
                currentGroup.close();
                currentGroup = null;
            }
        } finally {
            file.close();
            logger.trace("Closed {} after {} rows ({} emitted)", file.path(), rowsEncountered, rowsEmitted);
        }
    }
}
